package com.example.surveysession.audit;

import lombok.Value;

import java.time.Instant;

@Value
public class AuditStats {
    int auditFiles;
    long totalEvents;
    long highRiskEvents;
    long errorEvents;
    int retentionDays;
    Instant timestamp;
}
