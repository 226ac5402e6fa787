package com.example.surveysession.config;

import com.example.surveysession.audit.AuditTrail;
import com.example.surveysession.resilience.GuardSettings;
import com.example.surveysession.resilience.ResilienceGuard;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * One {@link ResilienceGuard} per dependency; their events go to the audit trail.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ResilienceGuard storeGuard(@Value("${app.resilience.store.failure-threshold:5}") int failureThreshold,
                                      @Value("${app.resilience.store.cooldown:60s}") Duration cooldown,
                                      @Value("${app.resilience.store.max-attempts:3}") int maxAttempts,
                                      @Value("${app.resilience.store.base-backoff:200ms}") Duration baseBackoff,
                                      @Value("${app.resilience.store.max-backoff:5s}") Duration maxBackoff,
                                      @Value("${app.resilience.store.timeout:5s}") Duration timeout,
                                      Clock clock,
                                      AuditTrail auditTrail) {
        GuardSettings settings = GuardSettings.builder()
                .failureThreshold(failureThreshold)
                .cooldown(cooldown)
                .maxAttempts(maxAttempts)
                .baseBackoff(baseBackoff)
                .maxBackoff(maxBackoff)
                .timeout(timeout)
                .build();
        ResilienceGuard guard = new ResilienceGuard("store", settings, clock);
        guard.setListener(auditTrail::recordGuardEvent);
        return guard;
    }

    @Bean(destroyMethod = "shutdown")
    public ResilienceGuard cacheGuard(@Value("${app.resilience.cache.failure-threshold:3}") int failureThreshold,
                                      @Value("${app.resilience.cache.cooldown:30s}") Duration cooldown,
                                      @Value("${app.resilience.cache.max-attempts:1}") int maxAttempts,
                                      @Value("${app.resilience.cache.base-backoff:50ms}") Duration baseBackoff,
                                      @Value("${app.resilience.cache.max-backoff:500ms}") Duration maxBackoff,
                                      @Value("${app.resilience.cache.timeout:1s}") Duration timeout,
                                      Clock clock,
                                      AuditTrail auditTrail) {
        GuardSettings settings = GuardSettings.builder()
                .failureThreshold(failureThreshold)
                .cooldown(cooldown)
                .maxAttempts(maxAttempts)
                .baseBackoff(baseBackoff)
                .maxBackoff(maxBackoff)
                .timeout(timeout)
                .build();
        ResilienceGuard guard = new ResilienceGuard("cache", settings, clock);
        guard.setListener(auditTrail::recordGuardEvent);
        return guard;
    }
}
