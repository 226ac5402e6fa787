package com.example.surveysession.health;

/**
 * Ordered from best to worst.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public static HealthStatus worstOf(HealthStatus a, HealthStatus b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
