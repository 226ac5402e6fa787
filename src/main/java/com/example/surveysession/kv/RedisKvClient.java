package com.example.surveysession.kv;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public boolean del(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return Boolean.TRUE.equals(redis.expire(key, ttl));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long seconds = redis.getExpire(key);
        if (seconds == null || seconds < 0) return Optional.empty();
        return Optional.of(Duration.ofSeconds(seconds));
    }

    @Override
    public long incrBy(String key, long delta) {
        Long value = redis.opsForValue().increment(key, delta);
        return value == null ? 0L : value;
    }

    @Override
    public boolean hset(String key, String field, String value) {
        // HSET replies whether the field was new, in the same round trip as the write
        Boolean created = redis.execute((RedisCallback<Boolean>) conn -> conn.hashCommands().hSet(
                key.getBytes(StandardCharsets.UTF_8),
                field.getBytes(StandardCharsets.UTF_8),
                value.getBytes(StandardCharsets.UTF_8)));
        return Boolean.TRUE.equals(created);
    }

    @Override
    public Optional<String> hget(String key, String field) {
        HashOperations<String, String, String> hash = redis.opsForHash();
        return Optional.ofNullable(hash.get(key, field));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        HashOperations<String, String, String> hash = redis.opsForHash();
        return new LinkedHashMap<>(hash.entries(key));
    }

    @Override
    public boolean hdel(String key, String field) {
        Long removed = redis.opsForHash().delete(key, field);
        return removed != null && removed > 0;
    }

    @Override
    public long sadd(String key, String... members) {
        Long added = redis.opsForSet().add(key, members);
        return added == null ? 0L : added;
    }

    @Override
    public Set<String> smembers(String key) {
        Set<String> members = redis.opsForSet().members(key);
        return members == null ? Set.of() : members;
    }

    @Override
    public long srem(String key, String... members) {
        Long removed = redis.opsForSet().remove(key, (Object[]) members);
        return removed == null ? 0L : removed;
    }

    @Override
    public boolean sismember(String key, String member) {
        return Boolean.TRUE.equals(redis.opsForSet().isMember(key, member));
    }

    @Override
    public List<String> scan(String pattern, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(pattern)
                .count(Math.max(limit, 100)).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }

    @Override
    public String ping() {
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            return conn.ping();
        }
    }
}
