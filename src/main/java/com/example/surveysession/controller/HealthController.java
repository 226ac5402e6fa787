package com.example.surveysession.controller;

import com.example.surveysession.health.HealthAggregator;
import com.example.surveysession.health.HealthReport;
import com.example.surveysession.health.HealthStatus;
import com.example.surveysession.health.LivenessReport;
import com.example.surveysession.health.ReadinessReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final HealthAggregator healthAggregator;

    public HealthController(HealthAggregator healthAggregator) {
        this.healthAggregator = healthAggregator;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthAggregator.check();
        HttpStatus status = report.getStatus() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/health/ready")
    public ResponseEntity<ReadinessReport> ready() {
        ReadinessReport report = healthAggregator.readiness();
        return ResponseEntity.status(report.isReady() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(report);
    }

    @GetMapping("/health/live")
    public ResponseEntity<LivenessReport> live() {
        LivenessReport report = healthAggregator.liveness();
        return ResponseEntity.status(report.isAlive() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(report);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<HealthReport> actuatorHealth() {
        return health();
    }
}
