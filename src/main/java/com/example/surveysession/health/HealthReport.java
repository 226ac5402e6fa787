package com.example.surveysession.health;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class HealthReport {
    HealthStatus status;
    Instant timestamp;
    long responseTimeMs;
    List<ProbeResult> checks;
    Summary summary;

    @Value
    public static class Summary {
        int total;
        long healthy;
        long degraded;
        long unhealthy;
    }
}
