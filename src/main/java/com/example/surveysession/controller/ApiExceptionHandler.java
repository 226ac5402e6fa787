package com.example.surveysession.controller;

import com.example.surveysession.error.ErrorCode;
import com.example.surveysession.error.SurveySessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {success:false, code, message}} with the status of
 * their {@link ErrorCode}. Retryable failures carry {@code Retry-After}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    @Value("${app.errors.include-stacktrace:false}")
    private boolean includeStacktrace;

    @ExceptionHandler(SurveySessionException.class)
    public ResponseEntity<Map<String, Object>> handleSessionException(SurveySessionException e) {
        if (e.getCode() == ErrorCode.INTERNAL) {
            logger.error("Request failed", e);
        } else if (e.getCode().isRetryable()) {
            logger.warn("Request failed with {}: {}", e.getCode(), e.getMessage());
        } else {
            logger.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return build(e.getCode(), e.getMessage(), e.getRetryAfter(), e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        logger.debug("Malformed request body: {}", e.getMessage());
        return build(ErrorCode.INVALID_INPUT, "Malformed request body", null, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // framework-level rejections: unknown route, wrong method, bad path variable
            int status = ((ErrorResponse) e).getStatusCode().value();
            if (status < 500) {
                logger.debug("Request rejected with {}: {}", status, e.getMessage());
                return build(status == 404 ? ErrorCode.NOT_FOUND : ErrorCode.INVALID_INPUT, e.getMessage(), null, e);
            }
        }
        logger.error("Unexpected error", e);
        return build(ErrorCode.INTERNAL, "Internal server error", null, e);
    }

    private ResponseEntity<Map<String, Object>> build(ErrorCode code, String message, Duration retryAfter, Throwable cause) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("code", code.name());
        body.put("message", message);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(code.getHttpStatus());
        if (code.isRetryable()) {
            Duration wait = retryAfter == null ? DEFAULT_RETRY_AFTER : retryAfter;
            long seconds = Math.max(1, (wait.toMillis() + 999) / 1000);
            body.put("retryAfterSeconds", seconds);
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        if (includeStacktrace && cause != null) {
            StringWriter trace = new StringWriter();
            cause.printStackTrace(new PrintWriter(trace));
            body.put("stack", trace.toString());
        }
        return response.body(body);
    }
}
