package com.example.surveysession.kv;

import com.example.surveysession.resilience.ResilienceGuard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Namespaced, JSON-valued cache on top of {@link KvClient}.
 *
 * <p>Nothing here ever throws. Every failure, including an open circuit or a
 * missing connection, is logged and answered with the empty result of the
 * operation. A value that no longer decodes is evicted and reported as a miss.</p>
 */
@Service
public class CacheService {

    private static final Logger logger = LoggerFactory.getLogger(CacheService.class);

    private static final int INVALIDATE_SCAN_LIMIT = 1000;

    private final KvClient kvClient;
    private final ResilienceGuard cacheGuard;
    private final ObjectMapper objectMapper;
    private final Map<CacheNamespace, Duration> defaultTtls;

    @Autowired
    public CacheService(KvClient kvClient,
                        @Qualifier("cacheGuard") ResilienceGuard cacheGuard,
                        ObjectMapper objectMapper,
                        @Value("${app.cache.ttl.session:3600}") long sessionTtlSec,
                        @Value("${app.cache.ttl.survey:1800}") long surveyTtlSec,
                        @Value("${app.cache.ttl.analytics:900}") long analyticsTtlSec,
                        @Value("${app.cache.ttl.rate-limit:3600}") long rateLimitTtlSec,
                        @Value("${app.cache.ttl.temp:300}") long tempTtlSec) {
        this(kvClient, cacheGuard, objectMapper, ttls(sessionTtlSec, surveyTtlSec, analyticsTtlSec, rateLimitTtlSec, tempTtlSec));
    }

    public CacheService(KvClient kvClient, ResilienceGuard cacheGuard, ObjectMapper objectMapper,
                        Map<CacheNamespace, Duration> defaultTtls) {
        this.kvClient = kvClient;
        this.cacheGuard = cacheGuard;
        this.objectMapper = objectMapper;
        this.defaultTtls = new EnumMap<>(defaultTtls);
    }

    private static Map<CacheNamespace, Duration> ttls(long session, long survey, long analytics, long rateLimit, long temp) {
        Map<CacheNamespace, Duration> ttls = new EnumMap<>(CacheNamespace.class);
        ttls.put(CacheNamespace.SESSION, Duration.ofSeconds(session));
        ttls.put(CacheNamespace.SURVEY, Duration.ofSeconds(survey));
        ttls.put(CacheNamespace.ANALYTICS, Duration.ofSeconds(analytics));
        ttls.put(CacheNamespace.RATE_LIMIT, Duration.ofSeconds(rateLimit));
        ttls.put(CacheNamespace.TEMP, Duration.ofSeconds(temp));
        return ttls;
    }

    public Duration defaultTtl(CacheNamespace namespace) {
        return defaultTtls.getOrDefault(namespace, Duration.ZERO);
    }

    public <T> Optional<T> get(CacheNamespace namespace, String id, Class<T> type) {
        String key = namespace.key(id);
        Optional<String> raw = call("get", key, () -> kvClient.get(key), Optional.<String>empty(), true);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding corrupt cache entry {}: {}", key, e.getOriginalMessage());
            delete(namespace, id);
            return Optional.empty();
        }
    }

    public boolean set(CacheNamespace namespace, String id, Object value) {
        return set(namespace, id, value, defaultTtl(namespace));
    }

    public boolean set(CacheNamespace namespace, String id, Object value, Duration ttl) {
        String key = namespace.key(id);
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Cannot serialize value for cache key {}", key, e);
            return false;
        }
        return call("set", key, () -> {
            kvClient.set(key, json, ttl);
            return true;
        }, false, true);
    }

    public boolean delete(CacheNamespace namespace, String id) {
        String key = namespace.key(id);
        return call("delete", key, () -> kvClient.del(key), false, true);
    }

    public boolean exists(CacheNamespace namespace, String id) {
        String key = namespace.key(id);
        return call("exists", key, () -> kvClient.exists(key), false, true);
    }

    public boolean expire(CacheNamespace namespace, String id, Duration ttl) {
        String key = namespace.key(id);
        return call("expire", key, () -> kvClient.expire(key, ttl), false, true);
    }

    public Optional<Duration> ttl(CacheNamespace namespace, String id) {
        String key = namespace.key(id);
        return call("ttl", key, () -> kvClient.ttl(key), Optional.<Duration>empty(), true);
    }

    /**
     * @return the counter after the increment, or empty if the cache could not be reached
     */
    public Optional<Long> increment(CacheNamespace namespace, String id, long delta) {
        String key = namespace.key(id);
        return call("increment", key, () -> Optional.of(kvClient.incrBy(key, delta)), Optional.<Long>empty(), false);
    }

    public Optional<Long> decrement(CacheNamespace namespace, String id, long delta) {
        return increment(namespace, id, -delta);
    }

    public boolean hset(CacheNamespace namespace, String id, String field, Object value) {
        String key = namespace.key(id);
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Cannot serialize hash field {} for cache key {}", field, key, e);
            return false;
        }
        return call("hset", key, () -> kvClient.hset(key, field, json), false, true);
    }

    public <T> Optional<T> hget(CacheNamespace namespace, String id, String field, Class<T> type) {
        String key = namespace.key(id);
        Optional<String> raw = call("hget", key, () -> kvClient.hget(key, field), Optional.<String>empty(), true);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding corrupt hash field {} in {}: {}", field, key, e.getOriginalMessage());
            hdel(namespace, id, field);
            return Optional.empty();
        }
    }

    /**
     * All fields of a hash, JSON-decoded where possible and raw otherwise.
     */
    public Map<String, Object> hgetAll(CacheNamespace namespace, String id) {
        String key = namespace.key(id);
        Map<String, String> raw = call("hgetall", key, () -> kvClient.hgetAll(key), Map.<String, String>of(), true);
        Map<String, Object> decoded = new LinkedHashMap<>();
        raw.forEach((field, value) -> {
            try {
                decoded.put(field, objectMapper.readValue(value, Object.class));
            } catch (JsonProcessingException e) {
                decoded.put(field, value);
            }
        });
        return decoded;
    }

    public boolean hdel(CacheNamespace namespace, String id, String field) {
        String key = namespace.key(id);
        return call("hdel", key, () -> kvClient.hdel(key, field), false, true);
    }

    public long sadd(CacheNamespace namespace, String id, String... members) {
        String key = namespace.key(id);
        return call("sadd", key, () -> kvClient.sadd(key, members), 0L, true);
    }

    public Set<String> smembers(CacheNamespace namespace, String id) {
        String key = namespace.key(id);
        return call("smembers", key, () -> kvClient.smembers(key), Set.<String>of(), true);
    }

    public long srem(CacheNamespace namespace, String id, String... members) {
        String key = namespace.key(id);
        return call("srem", key, () -> kvClient.srem(key, members), 0L, true);
    }

    public boolean sismember(CacheNamespace namespace, String id, String member) {
        String key = namespace.key(id);
        return call("sismember", key, () -> kvClient.sismember(key, member), false, true);
    }

    /**
     * Deletes every key of the namespace matching {@code pattern} (glob syntax,
     * without the namespace prefix).
     *
     * @return number of keys removed
     */
    public int invalidate(CacheNamespace namespace, String pattern) {
        String match = namespace.getPrefix() + pattern;
        List<String> keys = call("scan", match, () -> kvClient.scan(match, INVALIDATE_SCAN_LIMIT), List.<String>of(), true);
        int removed = 0;
        for (String key : keys) {
            if (call("delete", key, () -> kvClient.del(key), false, true)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Invalidated {} cache entries matching {}", removed, match);
        }
        return removed;
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        Map<String, Long> ttlSeconds = new LinkedHashMap<>();
        defaultTtls.forEach((ns, ttl) -> ttlSeconds.put(ns.name(), ttl.toSeconds()));
        stats.put("defaultTtlSeconds", ttlSeconds);
        stats.put("circuitBreaker", cacheGuard.getCircuitBreaker().snapshot());
        return stats;
    }

    private <T> T call(String operation, String key, Callable<T> action, T fallback, boolean retrySafe) {
        try {
            T result = cacheGuard.execute("cache " + operation, action, retrySafe);
            return result == null ? fallback : result;
        } catch (RuntimeException e) {
            logger.warn("Cache {} failed for {}, continuing without cache: {}", operation, key, e.getMessage());
            return fallback;
        }
    }
}
