package com.example.surveysession.store;

import com.example.surveysession.model.SessionStatus;
import com.example.surveysession.model.Submission;
import com.example.surveysession.model.SurveySession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative storage for sessions and finalized submissions.
 *
 * <p>Session writes are compare-and-swap on {@link SurveySession#getVersion()}:
 * a stale write fails with
 * {@link org.springframework.dao.OptimisticLockingFailureException}.</p>
 */
public interface StoreClient {
    SurveySession insertSession(SurveySession session);
    Optional<SurveySession> findSession(String sessionId);
    SurveySession saveSession(SurveySession session);

    /**
     * Deletes the session only if it still has {@code expectedVersion}.
     *
     * @return false if the session is gone or was changed in between
     */
    boolean deleteSession(String sessionId, Long expectedVersion);

    /**
     * Inserts the submission unless one with the same id exists.
     *
     * @return the stored record, either the new one or the one already there
     */
    Submission insertSubmissionIfAbsent(Submission submission);

    List<SurveySession> findByStatusInactiveSince(SessionStatus status, Instant cutoff, int limit);
    List<SurveySession> findTerminalInactiveSince(Instant cutoff, int limit);
    List<SurveySession> findRecentSessions(int limit);
    long countByStatus(SessionStatus status);
    long countSubmissions();

    /**
     * Round-trips to the database; throws if it cannot be reached.
     */
    void ping();
}
