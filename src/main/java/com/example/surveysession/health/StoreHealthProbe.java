package com.example.surveysession.health;

import com.example.surveysession.resilience.CircuitBreakerState;
import com.example.surveysession.resilience.ResilienceGuard;
import com.example.surveysession.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class StoreHealthProbe implements HealthProbe {

    private static final Logger logger = LoggerFactory.getLogger(StoreHealthProbe.class);

    private final StoreClient storeClient;
    private final ResilienceGuard storeGuard;
    private final long slowProbeMs;

    public StoreHealthProbe(StoreClient storeClient,
                            @Qualifier("storeGuard") ResilienceGuard storeGuard,
                            @Value("${app.health.slow-probe-ms:1000}") long slowProbeMs) {
        this.storeClient = storeClient;
        this.storeGuard = storeGuard;
        this.slowProbeMs = slowProbeMs;
    }

    @Override
    public String name() {
        return DATABASE;
    }

    @Override
    public ProbeResult check() {
        Map<String, Object> details = new LinkedHashMap<>();
        CircuitBreakerState breaker = storeGuard.getCircuitBreaker().getState();
        details.put("circuitBreaker", breaker.name());
        long start = System.nanoTime();
        try {
            storeClient.ping();
        } catch (RuntimeException e) {
            logger.warn("Database health check failed: {}", e.getMessage());
            details.put("error", e.getMessage());
            return ProbeResult.unhealthy(DATABASE, "Database health check failed", details);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        details.put("responseTimeMs", latencyMs);

        if (breaker != CircuitBreakerState.CLOSED) {
            return ProbeResult.of(DATABASE, HealthStatus.DEGRADED, "Database reachable, circuit " + breaker, details);
        }
        if (latencyMs > slowProbeMs) {
            return ProbeResult.of(DATABASE, HealthStatus.DEGRADED, "Database is slow", details);
        }
        return ProbeResult.of(DATABASE, HealthStatus.HEALTHY, "Database is healthy", details);
    }
}
