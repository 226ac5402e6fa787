package com.example.surveysession.resilience;

/**
 * Circuit breaker states.
 *
 * <pre>
 * CLOSED --(threshold consecutive failures)--> OPEN
 * OPEN   --(cooldown elapsed, one trial)-----> HALF_OPEN
 * HALF_OPEN --success--> CLOSED
 * HALF_OPEN --failure--> OPEN
 * </pre>
 */
public enum CircuitBreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
