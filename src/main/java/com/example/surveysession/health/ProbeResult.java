package com.example.surveysession.health;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class ProbeResult {
    String name;
    HealthStatus status;
    String message;
    Map<String, Object> details;
    Instant timestamp;

    public static ProbeResult of(String name, HealthStatus status, String message, Map<String, Object> details) {
        return new ProbeResult(name, status, message, details == null ? Map.of() : details, Instant.now());
    }

    public static ProbeResult unhealthy(String name, String message, Map<String, Object> details) {
        return of(name, HealthStatus.UNHEALTHY, message, details);
    }
}
