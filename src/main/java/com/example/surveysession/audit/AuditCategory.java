package com.example.surveysession.audit;

public enum AuditCategory {
    AUTHENTICATION,
    AUTHORIZATION,
    DATA_ACCESS,
    DATA_MODIFICATION,
    SYSTEM_CHANGES,
    SECURITY_EVENTS,
    PERFORMANCE,
    ERROR
}
