package com.example.surveysession.resilience;

import com.example.surveysession.error.DependencyUnavailableException;
import com.example.surveysession.error.OperationTimeoutException;
import com.example.surveysession.error.SurveySessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Wraps calls to one dependency with a per-attempt timeout, exponential-backoff
 * retry for retry-safe calls, and a circuit breaker.
 *
 * <p>A timed-out attempt is not cancelled: the dependency call keeps running on
 * the guard's executor and its result is dropped. Callers must only pass
 * operations that are safe to complete unobserved.</p>
 *
 * <p>Exceptions matched by the pass-through predicate are answers from a healthy
 * dependency (an optimistic-lock conflict, a duplicate key, a domain failure).
 * They are rethrown untouched, never retried and never counted against the
 * breaker.</p>
 */
public class ResilienceGuard {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceGuard.class);

    public static final Predicate<Throwable> DEFAULT_PASS_THROUGH = t ->
            t instanceof OptimisticLockingFailureException
                    || t instanceof DuplicateKeyException
                    || t instanceof SurveySessionException;

    private static final Duration MIN_RETRY_AFTER = Duration.ofSeconds(1);

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final BackoffCalculator backoff;
    private final int maxAttempts;
    private final Duration timeout;
    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final Predicate<Throwable> passThrough;
    private final Clock clock;
    private volatile GuardEventListener listener = GuardEventListener.NONE;

    public ResilienceGuard(String name, GuardSettings settings, Clock clock) {
        this(name, settings, clock, createExecutorService(name), Thread::sleep, DEFAULT_PASS_THROUGH);
    }

    public ResilienceGuard(String name, GuardSettings settings, Clock clock, ExecutorService executor,
                           Sleeper sleeper, Predicate<Throwable> passThrough) {
        if (settings.getMaxAttempts() <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + settings.getMaxAttempts() + ")");
        }
        this.name = name;
        this.circuitBreaker = new CircuitBreaker(name, settings.getFailureThreshold(), settings.getCooldown(), clock);
        this.backoff = new BackoffCalculator(settings.getBaseBackoff(), settings.getMaxBackoff());
        this.maxAttempts = settings.getMaxAttempts();
        this.timeout = settings.getTimeout();
        this.executor = executor;
        this.sleeper = sleeper;
        this.passThrough = passThrough;
        this.clock = clock;
    }

    private static ExecutorService createExecutorService(String name) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-guard-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code call} under the guard.
     *
     * @param operation name used in logs and events
     * @param retrySafe whether the call may be repeated after a failure or timeout
     * @throws DependencyUnavailableException the circuit is open or every attempt failed
     * @throws OperationTimeoutException the last attempt exceeded the deadline
     */
    public <T> T execute(String operation, Callable<T> call, boolean retrySafe) {
        int attempts = retrySafe ? maxAttempts : 1;
        Throwable lastFailure = null;
        boolean lastTimedOut = false;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!circuitBreaker.tryAcquire()) {
                CircuitBreakerState state = circuitBreaker.getState();
                logger.debug("{} circuit {}, rejecting {}", name, state, operation);
                throw new DependencyUnavailableException(
                        name + " unavailable (circuit " + state + "), " + operation + " rejected", retryAfter());
            }

            try {
                T result = awaitAttempt(call);
                recordSuccess(operation);
                return result;
            } catch (TimeoutException e) {
                lastFailure = e;
                lastTimedOut = true;
                logger.warn("{} {} timed out after {}ms (attempt {}/{})",
                        name, operation, timeout.toMillis(), attempt, attempts);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (passThrough.test(cause) && cause instanceof RuntimeException) {
                    recordSuccess(operation);
                    throw (RuntimeException) cause;
                }
                lastFailure = cause;
                lastTimedOut = false;
                logger.warn("{} {} failed (attempt {}/{}): {}", name, operation, attempt, attempts, cause.toString());
            } catch (RejectedExecutionException e) {
                lastFailure = e;
                lastTimedOut = false;
                logger.warn("{} {} could not be scheduled (attempt {}/{})", name, operation, attempt, attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                circuitBreaker.releaseTrial();
                throw new DependencyUnavailableException(name + " " + operation + " interrupted", retryAfter(), e);
            }

            if (circuitBreaker.recordFailure(lastFailure)) {
                publish(GuardEvent.Type.CIRCUIT_OPENED, operation,
                        "circuit opened after " + circuitBreaker.getConsecutiveFailures() + " consecutive failures");
            }

            if (attempt < attempts) {
                try {
                    sleeper.sleep(backoff.calculate(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    circuitBreaker.releaseTrial();
                    throw new DependencyUnavailableException(name + " " + operation + " interrupted", retryAfter(), e);
                }
            }
        }

        publish(GuardEvent.Type.RETRIES_EXHAUSTED, operation,
                attempts + " attempt(s) failed, last: " + lastFailure);
        if (lastTimedOut) {
            throw new OperationTimeoutException(
                    name + " " + operation + " timed out after " + timeout.toMillis() + "ms", retryAfter(), lastFailure);
        }
        throw new DependencyUnavailableException(name + " " + operation + " failed", retryAfter(), lastFailure);
    }

    private <T> T awaitAttempt(Callable<T> call) throws ExecutionException, TimeoutException, InterruptedException {
        Future<T> future = executor.submit(call);
        if (timeout == null || timeout.isZero()) {
            return future.get();
        }
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void recordSuccess(String operation) {
        if (circuitBreaker.recordSuccess()) {
            publish(GuardEvent.Type.CIRCUIT_CLOSED, operation, "trial call succeeded, circuit closed");
        }
    }

    private Duration retryAfter() {
        Duration cooldownLeft = circuitBreaker.remainingCooldown();
        return cooldownLeft.compareTo(MIN_RETRY_AFTER) > 0 ? cooldownLeft : MIN_RETRY_AFTER;
    }

    private void publish(GuardEvent.Type type, String operation, String message) {
        try {
            listener.onEvent(new GuardEvent(name, type, operation, message, clock.instant()));
        } catch (RuntimeException e) {
            logger.warn("Guard event listener failed for {} {}", name, type, e);
        }
    }

    public void setListener(GuardEventListener listener) {
        this.listener = listener == null ? GuardEventListener.NONE : listener;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
