package com.example.surveysession.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning for one {@link ResilienceGuard}.
 */
@Value
@Builder
public class GuardSettings {
    int failureThreshold;
    Duration cooldown;
    int maxAttempts;
    Duration baseBackoff;
    Duration maxBackoff;
    Duration timeout;
}
