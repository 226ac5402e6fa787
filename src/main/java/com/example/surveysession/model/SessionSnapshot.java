package com.example.surveysession.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read view of a session returned by status queries.
 */
@Value
@Builder
public class SessionSnapshot {
    String sessionId;
    SessionStatus status;
    int currentPage;
    int totalPages;
    Instant createdAt;
    Instant lastActivity;
    SurveyAnswers surveyData;

    public static SessionSnapshot of(SurveySession session) {
        return SessionSnapshot.builder()
                .sessionId(session.getSessionId())
                .status(session.getStatus())
                .currentPage(session.getCurrentPage())
                .totalPages(session.getTotalPages())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .surveyData(session.getSurveyData())
                .build();
    }
}
