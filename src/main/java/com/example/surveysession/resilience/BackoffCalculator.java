package com.example.surveysession.resilience;

import java.time.Duration;

/**
 * Exponential backoff between retry attempts.
 *
 * <pre>
 * delay = min(base * 2^(attempt-1), max)
 * </pre>
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public BackoffCalculator(Duration baseDelay, Duration maxDelay) {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        if (base < 0) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + base + "ms)");
        }
        if (max < base) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (base: " + base + "ms, max: " + max + "ms)");
        }
        this.baseDelayMs = base;
        this.maxDelayMs = max;
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @return milliseconds to wait before the next attempt
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // shifts past 62 overflow; the cap applies long before that
        int shift = Math.min(attempt - 1, 30);
        return Math.min(baseDelayMs * (1L << shift), maxDelayMs);
    }
}
