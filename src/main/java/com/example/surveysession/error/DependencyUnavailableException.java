package com.example.surveysession.error;

import java.time.Duration;

/**
 * A dependency rejected the call (breaker open) or kept failing until the
 * retry budget ran out.
 */
public class DependencyUnavailableException extends SurveySessionException {

    public DependencyUnavailableException(String message, Duration retryAfter) {
        super(ErrorCode.UNAVAILABLE, message, retryAfter, null);
    }

    public DependencyUnavailableException(String message, Duration retryAfter, Throwable cause) {
        super(ErrorCode.UNAVAILABLE, message, retryAfter, cause);
    }
}
