package com.example.surveysession.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("sessions")
public class SurveySession {
    @Id
    private String sessionId;
    @Indexed
    private SessionStatus status;
    private int currentPage;
    private int totalPages;
    private SurveyAnswers surveyData;
    private ClientMetadata metadata;

    @Indexed
    private Instant createdAt;
    @Indexed
    private Instant lastActivity;
    private Instant completedAt;
    private Instant expiredAt;
    private Instant abandonedAt;

    // optimistic lock; every store write compares and bumps it
    @Version
    private Long version;

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /**
     * Moves {@code lastActivity} forward, never backward.
     */
    public void touch(Instant now) {
        if (lastActivity == null || now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }
}
