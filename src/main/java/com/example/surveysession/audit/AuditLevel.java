package com.example.surveysession.audit;

public enum AuditLevel {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
