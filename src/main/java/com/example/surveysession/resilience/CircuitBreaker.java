package com.example.surveysession.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consecutive-failure circuit breaker for a single dependency.
 *
 * <p>State is process-local and shared by every caller of the dependency, so
 * all transitions happen under the instance monitor. While HALF_OPEN exactly
 * one trial call is admitted; its outcome decides between CLOSED and a fresh
 * OPEN period.</p>
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private Instant lastFailureAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Decides whether a call may reach the dependency.
     *
     * @return false while OPEN within the cooldown, or while the HALF_OPEN trial is still running
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openedAt.plus(cooldown))) {
                    return false;
                }
                state = CircuitBreakerState.HALF_OPEN;
                trialInFlight = true;
                logger.info("Circuit {} cooldown elapsed, admitting one trial call", name);
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    /**
     * Records a successful call.
     *
     * @return true if this success closed a HALF_OPEN circuit
     */
    public synchronized boolean recordSuccess() {
        if (state == CircuitBreakerState.OPEN) {
            // a call admitted before the circuit opened; it does not close it
            return false;
        }
        boolean closing = state == CircuitBreakerState.HALF_OPEN;
        if (closing) {
            logger.info("Circuit {} trial call succeeded, closing", name);
        }
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
        openedAt = null;
        return closing;
    }

    /**
     * Gives back a HALF_OPEN trial permit whose call ended without an outcome,
     * so the next caller can run the trial instead.
     */
    public synchronized void releaseTrial() {
        if (state == CircuitBreakerState.HALF_OPEN && trialInFlight) {
            trialInFlight = false;
            logger.info("Circuit {} trial call abandoned, next call runs the trial", name);
        }
    }

    /**
     * Records a failed call.
     *
     * @return true if this failure moved the circuit to OPEN
     */
    public synchronized boolean recordFailure(Throwable failure) {
        lastFailureAt = clock.instant();
        consecutiveFailures++;
        if (state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
            open(failure);
            return true;
        }
        if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= failureThreshold) {
            open(failure);
            return true;
        }
        return false;
    }

    private void open(Throwable failure) {
        state = CircuitBreakerState.OPEN;
        openedAt = clock.instant();
        logger.warn("Circuit {} OPEN after {} consecutive failures, cooldown {}ms: {}",
                name, consecutiveFailures, cooldown.toMillis(),
                failure == null ? "n/a" : failure.toString());
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Time left before an OPEN circuit admits its trial call; zero otherwise.
     */
    public synchronized Duration remainingCooldown() {
        if (state != CircuitBreakerState.OPEN) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), openedAt.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Forces the circuit back to CLOSED and clears all counters.
     */
    public synchronized void reset() {
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
        openedAt = null;
        lastFailureAt = null;
        logger.info("Circuit {} reset", name);
    }

    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("name", name);
        snapshot.put("state", state.name());
        snapshot.put("consecutiveFailures", consecutiveFailures);
        snapshot.put("failureThreshold", failureThreshold);
        snapshot.put("cooldownMs", cooldown.toMillis());
        snapshot.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
        return snapshot;
    }
}
