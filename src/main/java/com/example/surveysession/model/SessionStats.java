package com.example.surveysession.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SessionStats {
    long activeSessions;
    long completedSessions;
    long abandonedSessions;
    long expiredSessions;
    long submissions;
    List<RecentSession> recentSessions;

    @Value
    public static class RecentSession {
        String sessionId;
        SessionStatus status;
        int currentPage;
        Instant createdAt;
    }
}
