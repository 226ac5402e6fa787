package com.example.surveysession.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the audit trail. Stored as an element of the daily JSON array.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AuditEntry {
    Instant timestamp;
    @Builder.Default
    AuditLevel level = AuditLevel.INFO;
    @Builder.Default
    AuditCategory category = AuditCategory.SYSTEM_CHANGES;
    String action;
    String resource;
    @Builder.Default
    String actor = "system";
    @Builder.Default
    String networkOrigin = "unknown";
    @Builder.Default
    AuditOutcome outcome = AuditOutcome.SUCCESS;
    @Builder.Default
    RiskLevel risk = RiskLevel.LOW;
    @Builder.Default
    Map<String, Object> details = Map.of();

    @JsonIgnore
    public boolean isHighRisk() {
        return (risk != null && risk.isAtLeast(RiskLevel.HIGH)) || level == AuditLevel.CRITICAL;
    }

    /**
     * Case-insensitive match against the textual fields of the entry.
     */
    public boolean mentions(String query) {
        String needle = query.toLowerCase();
        return contains(action, needle)
                || contains(resource, needle)
                || contains(actor, needle)
                || contains(networkOrigin, needle)
                || (level != null && contains(level.name(), needle))
                || (category != null && contains(category.name(), needle))
                || (outcome != null && contains(outcome.name(), needle))
                || (risk != null && contains(risk.name(), needle));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase().contains(needle);
    }
}
