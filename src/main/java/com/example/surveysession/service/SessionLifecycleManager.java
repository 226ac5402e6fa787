package com.example.surveysession.service;

import com.example.surveysession.audit.AuditCategory;
import com.example.surveysession.audit.AuditTrail;
import com.example.surveysession.error.DependencyUnavailableException;
import com.example.surveysession.error.InvalidInputException;
import com.example.surveysession.error.SessionNotFoundException;
import com.example.surveysession.error.SurveySessionException;
import com.example.surveysession.kv.CacheNamespace;
import com.example.surveysession.kv.CacheService;
import com.example.surveysession.model.ClientMetadata;
import com.example.surveysession.model.SessionSnapshot;
import com.example.surveysession.model.SessionStats;
import com.example.surveysession.model.SessionStatus;
import com.example.surveysession.model.Submission;
import com.example.surveysession.model.SubmissionReceipt;
import com.example.surveysession.model.SurveyAnswers;
import com.example.surveysession.model.SurveySession;
import com.example.surveysession.model.SweepResult;
import com.example.surveysession.resilience.ResilienceGuard;
import com.example.surveysession.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Session lifecycle over the durable store (authoritative) and the cache
 * (best-effort).
 *
 * <p>Every store write is a compare-and-swap on the session version. A write
 * that loses a race is re-read from the store and re-applied, so a stale cached
 * snapshot can never overwrite a newer update.</p>
 */
@Service
public class SessionLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleManager.class);

    private static final Pattern SESSION_ID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final int RECENT_SESSIONS = 10;
    private static final Duration CONFLICT_RETRY_AFTER = Duration.ofSeconds(1);

    private final StoreClient storeClient;
    private final ResilienceGuard storeGuard;
    private final CacheService cacheService;
    private final AuditTrail auditTrail;
    private final Clock clock;

    @Value("${app.session.total-pages:8}")
    private int totalPages = 8;

    @Value("${app.session.inactivity-window:1h}")
    private Duration inactivityWindow = Duration.ofHours(1);

    @Value("${app.session.purge-after:24h}")
    private Duration purgeAfter = Duration.ofHours(24);

    @Value("${app.session.conflict-retries:3}")
    private int conflictRetries = 3;

    @Value("${app.session.sweep-batch-size:500}")
    private int sweepBatchSize = 500;

    @Value("${app.session.cache-tombstone-ttl:60s}")
    private Duration tombstoneTtl = Duration.ofSeconds(60);

    public SessionLifecycleManager(StoreClient storeClient,
                                   @Qualifier("storeGuard") ResilienceGuard storeGuard,
                                   CacheService cacheService,
                                   AuditTrail auditTrail,
                                   Clock clock) {
        this.storeClient = storeClient;
        this.storeGuard = storeGuard;
        this.cacheService = cacheService;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    public SessionSnapshot createSession(ClientMetadata metadata) {
        Instant now = clock.instant();
        SurveySession session = SurveySession.builder()
                .sessionId(UUID.randomUUID().toString())
                .status(SessionStatus.ACTIVE)
                .currentPage(0)
                .totalPages(totalPages)
                .surveyData(SurveyAnswers.empty())
                .metadata(metadata == null ? new ClientMetadata() : metadata)
                .createdAt(now)
                .lastActivity(now)
                .build();

        // a fresh id per call, so a blind retry could leave an orphan behind
        SurveySession saved = storeGuard.execute("insert session", () -> storeClient.insertSession(session), false);
        cacheService.set(CacheNamespace.SESSION, saved.getSessionId(), saved);

        logger.info("Created session {}", saved.getSessionId());
        auditTrail.record(AuditCategory.DATA_MODIFICATION, "create", "session",
                Map.of("sessionId", saved.getSessionId()));
        return SessionSnapshot.of(saved);
    }

    /**
     * Merges {@code data} into the session's answers and advances its page.
     *
     * @return the session as stored after the write
     */
    public SessionSnapshot saveProgress(String sessionId, Integer page, SurveyAnswers data) {
        validateSessionId(sessionId);
        if (page == null || page < 0) {
            throw new InvalidInputException("Invalid page number: " + page);
        }
        SurveyAnswers patch = data == null ? SurveyAnswers.empty() : data;

        SurveySession current = readThrough(sessionId)
                .filter(SurveySession::isActive)
                .orElseGet(() -> loadActive(sessionId));

        SurveySession saved = updateWithRetry(sessionId, current, "save progress", session -> {
            if (page >= session.getTotalPages()) {
                throw new InvalidInputException("Invalid page number: " + page
                        + " (session has " + session.getTotalPages() + " pages)");
            }
            SurveyAnswers base = session.getSurveyData() == null ? SurveyAnswers.empty() : session.getSurveyData();
            SurveySession updated = session.toBuilder()
                    .surveyData(base.mergedWith(patch))
                    .currentPage(Math.max(session.getCurrentPage(), page))
                    .build();
            updated.touch(clock.instant());
            return updated;
        });
        logger.debug("Saved progress for session {} (page {})", sessionId, saved.getCurrentPage());
        return SessionSnapshot.of(saved);
    }

    /**
     * Current state of a session in any status.
     */
    public SessionSnapshot getStatus(String sessionId) {
        validateSessionId(sessionId);
        return readThrough(sessionId)
                .map(SessionSnapshot::of)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Finalizes an active session into a permanent submission and removes the session.
     *
     * <p>The submission id is derived from the session id, so a repeated or
     * concurrent submit finds the record already there. Only the caller whose
     * version-checked delete removes the session gets a receipt; the others see
     * the session as gone.</p>
     */
    public SubmissionReceipt submit(String sessionId) {
        validateSessionId(sessionId);
        SurveySession session = loadActive(sessionId);

        Submission candidate = Submission.builder()
                .submissionId(Submission.idFor(sessionId))
                .sessionId(sessionId)
                .answers(session.getSurveyData() == null ? SurveyAnswers.empty() : session.getSurveyData())
                .metadata(session.getMetadata())
                .sessionCreatedAt(session.getCreatedAt())
                .submittedAt(clock.instant())
                .build();
        Submission stored = storeGuard.execute("insert submission",
                () -> storeClient.insertSubmissionIfAbsent(candidate), true);
        cacheService.set(CacheNamespace.SURVEY, stored.getSubmissionId(), stored);

        boolean deleted = storeGuard.execute("delete session",
                () -> storeClient.deleteSession(sessionId, session.getVersion()), false);
        retireCachedSession(sessionId);
        if (!deleted) {
            logger.info("Session {} was finalized or changed concurrently", sessionId);
            throw new SessionNotFoundException(sessionId);
        }

        cacheService.invalidate(CacheNamespace.ANALYTICS, "*");
        cacheService.delete(CacheNamespace.SURVEY, "stats");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", sessionId);
        details.put("surveyId", stored.getSubmissionId());
        details.put("submittedAt", stored.getSubmittedAt().toString());
        auditTrail.record(AuditCategory.DATA_MODIFICATION, "delete", "session", details);
        logger.info("Session {} submitted as {}", sessionId, stored.getSubmissionId());
        return new SubmissionReceipt(sessionId, stored.getSubmissionId(), stored.getSubmittedAt());
    }

    public void abandon(String sessionId) {
        validateSessionId(sessionId);
        SurveySession current = loadActive(sessionId);
        updateWithRetry(sessionId, current, "abandon session", session -> {
            Instant now = clock.instant();
            SurveySession updated = session.toBuilder()
                    .status(SessionStatus.ABANDONED)
                    .abandonedAt(now)
                    .build();
            updated.touch(now);
            return updated;
        });
        retireCachedSession(sessionId);
        logger.info("Session {} abandoned", sessionId);
        auditTrail.record(AuditCategory.DATA_MODIFICATION, "abandon", "session", Map.of("sessionId", sessionId));
    }

    public SessionStats stats() {
        List<SessionStats.RecentSession> recent = new ArrayList<>();
        for (SurveySession s : storeGuard.execute("recent sessions",
                () -> storeClient.findRecentSessions(RECENT_SESSIONS), true)) {
            recent.add(new SessionStats.RecentSession(s.getSessionId(), s.getStatus(), s.getCurrentPage(), s.getCreatedAt()));
        }
        return SessionStats.builder()
                .activeSessions(count(SessionStatus.ACTIVE))
                .completedSessions(count(SessionStatus.COMPLETED))
                .abandonedSessions(count(SessionStatus.ABANDONED))
                .expiredSessions(count(SessionStatus.EXPIRED))
                .submissions(storeGuard.execute("count submissions", storeClient::countSubmissions, true))
                .recentSessions(recent)
                .build();
    }

    /**
     * Expires ACTIVE sessions idle for longer than the inactivity window and
     * purges terminal sessions idle for longer than the purge window. Sessions
     * changed while the sweep runs are left alone.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        Instant expireCutoff = now.minus(inactivityWindow);
        int expired = 0;
        for (SurveySession session : storeGuard.execute("find idle sessions",
                () -> storeClient.findByStatusInactiveSince(SessionStatus.ACTIVE, expireCutoff, sweepBatchSize), true)) {
            if (!session.isActive() || !session.getLastActivity().isBefore(expireCutoff)) {
                continue;
            }
            SurveySession expiredSession = session.toBuilder()
                    .status(SessionStatus.EXPIRED)
                    .expiredAt(now)
                    .build();
            try {
                storeGuard.execute("expire session", () -> storeClient.saveSession(expiredSession), true);
                retireCachedSession(session.getSessionId());
                expired++;
            } catch (OptimisticLockingFailureException e) {
                logger.debug("Session {} changed during sweep, not expiring", session.getSessionId());
            }
        }

        Instant purgeCutoff = now.minus(purgeAfter);
        int purged = 0;
        for (SurveySession session : storeGuard.execute("find purgeable sessions",
                () -> storeClient.findTerminalInactiveSince(purgeCutoff, sweepBatchSize), true)) {
            if (!session.getStatus().isTerminal()) {
                continue;
            }
            if (storeGuard.execute("purge session",
                    () -> storeClient.deleteSession(session.getSessionId(), session.getVersion()), true)) {
                retireCachedSession(session.getSessionId());
                purged++;
            }
        }

        if (expired > 0 || purged > 0) {
            logger.info("Session sweep expired {} and purged {} session(s)", expired, purged);
            auditTrail.record(AuditCategory.SYSTEM_CHANGES, "sweep", "session",
                    Map.of("expired", expired, "purged", purged));
        }
        return new SweepResult(expired, purged);
    }

    @Scheduled(fixedDelayString = "${app.session.sweep-interval-ms:300000}",
            initialDelayString = "${app.session.sweep-initial-delay-ms:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (SurveySessionException e) {
            logger.warn("Session sweep skipped: {}", e.getMessage());
        }
    }

    private SurveySession updateWithRetry(String sessionId, SurveySession start, String operation,
                                          UnaryOperator<SurveySession> change) {
        SurveySession current = start;
        for (int attempt = 1; ; attempt++) {
            if (!current.isActive()) {
                throw new SessionNotFoundException(sessionId);
            }
            SurveySession updated = change.apply(current);
            try {
                SurveySession saved = storeGuard.execute(operation, () -> storeClient.saveSession(updated), true);
                cacheService.delete(CacheNamespace.SESSION, sessionId);
                return saved;
            } catch (OptimisticLockingFailureException e) {
                cacheService.delete(CacheNamespace.SESSION, sessionId);
                if (attempt >= conflictRetries) {
                    logger.warn("Giving up {} for session {} after {} conflicting writes", operation, sessionId, attempt);
                    throw new DependencyUnavailableException(
                            "Session " + sessionId + " is being updated concurrently", CONFLICT_RETRY_AFTER, e);
                }
                logger.debug("Version conflict on {} for session {}, re-reading (attempt {})", operation, sessionId, attempt);
                current = loadActive(sessionId);
            }
        }
    }

    private Optional<SurveySession> readThrough(String sessionId) {
        Optional<SurveySession> cached = cacheService.get(CacheNamespace.SESSION, sessionId, SurveySession.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<SurveySession> stored = findInStore(sessionId);
        stored.ifPresent(s -> {
            cacheService.set(CacheNamespace.SESSION, sessionId, s);
            // a retire may have raced this read; its tombstone wins
            if (cacheService.exists(CacheNamespace.TEMP, tombstoneKey(sessionId))) {
                cacheService.delete(CacheNamespace.SESSION, sessionId);
            }
        });
        return stored;
    }

    /**
     * Drops the cached copy of a session that left the ACTIVE state. The
     * tombstone is written first so a concurrent {@link #readThrough} that
     * repopulates the cache afterwards sees it and evicts its own entry.
     */
    private void retireCachedSession(String sessionId) {
        cacheService.set(CacheNamespace.TEMP, tombstoneKey(sessionId), true, tombstoneTtl);
        cacheService.delete(CacheNamespace.SESSION, sessionId);
    }

    private static String tombstoneKey(String sessionId) {
        return "session-gone:" + sessionId;
    }

    private SurveySession loadActive(String sessionId) {
        return findInStore(sessionId)
                .filter(SurveySession::isActive)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private Optional<SurveySession> findInStore(String sessionId) {
        return storeGuard.execute("find session", () -> storeClient.findSession(sessionId), true);
    }

    private long count(SessionStatus status) {
        return storeGuard.execute("count " + status.name().toLowerCase() + " sessions",
                () -> storeClient.countByStatus(status), true);
    }

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            throw new InvalidInputException("Invalid session id: " + sessionId);
        }
    }
}
