package com.example.surveysession.audit;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
