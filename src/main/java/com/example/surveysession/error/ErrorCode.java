package com.example.surveysession.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy surfaced to callers of the session and health operations.
 */
public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    INVALID_INPUT(HttpStatus.BAD_REQUEST, false),
    TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, true),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorCode(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
