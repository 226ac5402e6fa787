package com.example.surveysession.error;

import java.time.Duration;

/**
 * Base for every failure the session layer reports on purpose.
 *
 * <p>Retryable codes carry a suggested retry interval that the HTTP layer
 * turns into a {@code Retry-After} header.</p>
 */
public class SurveySessionException extends RuntimeException {

    private final ErrorCode code;
    private final Duration retryAfter;

    public SurveySessionException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public SurveySessionException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public SurveySessionException(ErrorCode code, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryAfter = retryAfter;
    }

    public ErrorCode getCode() {
        return code;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
