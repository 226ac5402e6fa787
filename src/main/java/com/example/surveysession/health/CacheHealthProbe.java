package com.example.surveysession.health;

import com.example.surveysession.kv.KvClient;
import com.example.surveysession.resilience.CircuitBreakerState;
import com.example.surveysession.resilience.ResilienceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CacheHealthProbe implements HealthProbe {

    private static final Logger logger = LoggerFactory.getLogger(CacheHealthProbe.class);

    private final KvClient kvClient;
    private final ResilienceGuard cacheGuard;
    private final boolean ignoreCache;
    private final long slowProbeMs;

    public CacheHealthProbe(KvClient kvClient,
                            @Qualifier("cacheGuard") ResilienceGuard cacheGuard,
                            @Value("${app.health.ignore-cache:false}") boolean ignoreCache,
                            @Value("${app.health.slow-probe-ms:1000}") long slowProbeMs) {
        this.kvClient = kvClient;
        this.cacheGuard = cacheGuard;
        this.ignoreCache = ignoreCache;
        this.slowProbeMs = slowProbeMs;
    }

    @Override
    public String name() {
        return CACHE;
    }

    @Override
    public ProbeResult check() {
        if (ignoreCache) {
            return ProbeResult.of(CACHE, HealthStatus.HEALTHY, "Redis health ignored by configuration",
                    Map.of("ignored", true));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        CircuitBreakerState breaker = cacheGuard.getCircuitBreaker().getState();
        details.put("circuitBreaker", breaker.name());
        long start = System.nanoTime();
        try {
            String pong = kvClient.ping();
            details.put("ping", pong);
        } catch (RuntimeException e) {
            logger.warn("Cache health check failed: {}", e.getMessage());
            details.put("error", e.getMessage());
            return ProbeResult.unhealthy(CACHE, "Redis health check failed", details);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        details.put("responseTimeMs", latencyMs);

        if (breaker != CircuitBreakerState.CLOSED) {
            return ProbeResult.of(CACHE, HealthStatus.DEGRADED, "Redis reachable, circuit " + breaker, details);
        }
        if (latencyMs > slowProbeMs) {
            return ProbeResult.of(CACHE, HealthStatus.DEGRADED, "Redis is slow", details);
        }
        return ProbeResult.of(CACHE, HealthStatus.HEALTHY, "Redis is healthy", details);
    }
}
