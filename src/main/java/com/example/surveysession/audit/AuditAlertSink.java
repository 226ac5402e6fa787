package com.example.surveysession.audit;

/**
 * Receives audit entries that are high risk or critical.
 */
@FunctionalInterface
public interface AuditAlertSink {
    void alert(AuditEntry entry);
}
