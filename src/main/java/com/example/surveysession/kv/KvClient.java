package com.example.surveysession.kv;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raw key-value access. Implementations may throw on any failure; callers
 * that need non-fatal behaviour go through {@link CacheService}.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    boolean del(String key);
    boolean exists(String key);
    boolean expire(String key, Duration ttl);
    Optional<Duration> ttl(String key);
    long incrBy(String key, long delta);

    boolean hset(String key, String field, String value);
    Optional<String> hget(String key, String field);
    Map<String, String> hgetAll(String key);
    boolean hdel(String key, String field);

    long sadd(String key, String... members);
    Set<String> smembers(String key);
    long srem(String key, String... members);
    boolean sismember(String key, String member);

    List<String> scan(String pattern, int limit);
    String ping();
}
