package com.example.surveysession.error;

import java.time.Duration;

public class OperationTimeoutException extends SurveySessionException {

    public OperationTimeoutException(String message, Duration retryAfter, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, retryAfter, cause);
    }
}
