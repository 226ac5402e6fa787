package com.example.surveysession.service;

import com.example.surveysession.audit.AuditCategory;
import com.example.surveysession.audit.AuditTrail;
import com.example.surveysession.error.DependencyUnavailableException;
import com.example.surveysession.error.ErrorCode;
import com.example.surveysession.error.InvalidInputException;
import com.example.surveysession.error.SessionNotFoundException;
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
import com.example.surveysession.resilience.GuardSettings;
import com.example.surveysession.resilience.ResilienceGuard;
import com.example.surveysession.support.InMemoryKvClient;
import com.example.surveysession.support.InMemoryStoreClient;
import com.example.surveysession.support.TestClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleManagerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private AuditTrail auditTrail;

    private TestClock clock;
    private InMemoryStoreClient store;
    private InMemoryKvClient kv;
    private ResilienceGuard storeGuard;
    private ResilienceGuard cacheGuard;
    private CacheService cacheService;
    private SessionLifecycleManager manager;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        store = new InMemoryStoreClient();
        kv = new InMemoryKvClient();
        storeGuard = guard("store", 5, 3);
        cacheGuard = guard("cache", 3, 1);
        cacheService = new CacheService(kv, cacheGuard, new ObjectMapper().findAndRegisterModules(), ttls());
        manager = newManager(store);
    }

    @AfterEach
    void tearDown() {
        storeGuard.shutdown();
        cacheGuard.shutdown();
    }

    private ResilienceGuard guard(String name, int threshold, int attempts) {
        return new ResilienceGuard(name, GuardSettings.builder()
                .failureThreshold(threshold)
                .cooldown(Duration.ofSeconds(30))
                .maxAttempts(attempts)
                .baseBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(5))
                .timeout(Duration.ofSeconds(2))
                .build(), clock, Executors.newCachedThreadPool(), millis -> { }, ResilienceGuard.DEFAULT_PASS_THROUGH);
    }

    private SessionLifecycleManager newManager(InMemoryStoreClient storeClient) {
        return new SessionLifecycleManager(storeClient, storeGuard, cacheService, auditTrail, clock);
    }

    private static Map<CacheNamespace, Duration> ttls() {
        Map<CacheNamespace, Duration> ttls = new EnumMap<>(CacheNamespace.class);
        for (CacheNamespace ns : CacheNamespace.values()) {
            ttls.put(ns, Duration.ofMinutes(30));
        }
        return ttls;
    }

    private String create() {
        return manager.createSession(ClientMetadata.builder()
                .ipAddress("10.0.0.1")
                .userAgent("JUnit")
                .deviceType("mobile")
                .browser("Firefox")
                .build()).getSessionId();
    }

    @Test
    void unknownSessionIsNotFoundEverywhere() {
        String unknown = UUID.randomUUID().toString();

        assertThatThrownBy(() -> manager.getStatus(unknown)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> manager.saveProgress(unknown, 0, SurveyAnswers.empty()))
                .isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> manager.submit(unknown)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> manager.abandon(unknown)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void malformedIdIsInvalidInput() {
        assertThatThrownBy(() -> manager.getStatus("not-a-uuid"))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(e -> assertThat(((InvalidInputException) e).getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    void createdSessionIsActiveOnFirstPage() {
        String id = create();

        SessionSnapshot status = manager.getStatus(id);
        assertThat(status.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(status.getCurrentPage()).isZero();
        assertThat(status.getTotalPages()).isEqualTo(8);
        assertThat(status.getCreatedAt()).isEqualTo(START);
        assertThat(kv.containsKey("session:" + id)).isTrue();
        assertThat(store.peek(id)).hasValueSatisfying(s -> assertThat(s.getMetadata().getBrowser()).isEqualTo("Firefox"));
        verify(auditTrail).record(eq(AuditCategory.DATA_MODIFICATION), eq("create"), eq("session"), anyMap());
    }

    @Test
    void progressMergesFieldsAndNeverMovesPageBackwards() {
        String id = create();

        manager.saveProgress(id, 2, SurveyAnswers.builder().gender("F").build());
        manager.saveProgress(id, 1, SurveyAnswers.builder().university("Makerere").build());
        SessionSnapshot latest = manager.saveProgress(id, 1,
                SurveyAnswers.builder().gender("M").socialMediaPlatforms(List.of("TikTok", "X")).build());

        assertThat(latest.getCurrentPage()).isEqualTo(2);
        SurveyAnswers answers = manager.getStatus(id).getSurveyData();
        assertThat(answers.getGender()).isEqualTo("M");
        assertThat(answers.getUniversity()).isEqualTo("Makerere");
        assertThat(answers.getSocialMediaPlatforms()).containsExactly("TikTok", "X");
    }

    @Test
    void progressAdvancesLastActivityAndInvalidatesCache() {
        String id = create();
        clock.advance(Duration.ofMinutes(5));

        SessionSnapshot saved = manager.saveProgress(id, 1, SurveyAnswers.builder().gender("F").build());

        assertThat(saved.getLastActivity()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(kv.containsKey("session:" + id)).isFalse();
    }

    @Test
    void progressRejectsPagesOutsideTheSurvey() {
        String id = create();

        assertThatThrownBy(() -> manager.saveProgress(id, -1, null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> manager.saveProgress(id, null, null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> manager.saveProgress(id, 8, null)).isInstanceOf(InvalidInputException.class);
        assertThat(manager.saveProgress(id, 7, null).getCurrentPage()).isEqualTo(7);
    }

    @Test
    void pageRangeFollowsConfiguredSurveyLength() {
        ReflectionTestUtils.setField(manager, "totalPages", 3);
        String id = create();

        assertThat(manager.getStatus(id).getTotalPages()).isEqualTo(3);
        assertThatThrownBy(() -> manager.saveProgress(id, 3, null)).isInstanceOf(InvalidInputException.class);
        assertThat(manager.saveProgress(id, 2, null).getCurrentPage()).isEqualTo(2);
    }

    @Test
    void staleCachedSnapshotDoesNotLoseConcurrentUpdate() {
        String id = create();
        // another writer updates the store behind the cached copy
        SurveySession stored = store.peek(id).orElseThrow();
        store.saveSession(stored.toBuilder().surveyData(SurveyAnswers.builder().university("Kyambogo").build()).build());

        manager.saveProgress(id, 1, SurveyAnswers.builder().gender("F").build());

        SurveySession result = store.peek(id).orElseThrow();
        assertThat(result.getSurveyData().getUniversity()).isEqualTo("Kyambogo");
        assertThat(result.getSurveyData().getGender()).isEqualTo("F");
        assertThat(result.getVersion()).isEqualTo(2L);
    }

    @Test
    void persistentConflictsSurfaceAsRetryableUnavailable() {
        InMemoryStoreClient alwaysStale = new InMemoryStoreClient() {
            @Override
            public synchronized SurveySession saveSession(SurveySession session) {
                throw new OptimisticLockingFailureException("always stale");
            }
        };
        SessionLifecycleManager contended = newManager(alwaysStale);
        String id = contended.createSession(new ClientMetadata()).getSessionId();

        assertThatThrownBy(() -> contended.saveProgress(id, 1, SurveyAnswers.builder().gender("F").build()))
                .isInstanceOf(DependencyUnavailableException.class)
                .satisfies(e -> assertThat(((DependencyUnavailableException) e).getCode().isRetryable()).isTrue());
    }

    @Test
    void submitFinalizesOnceAndRemovesSession() {
        String id = create();
        manager.saveProgress(id, 7, SurveyAnswers.builder().gender("F").suggestions("More colours").build());
        clock.advance(Duration.ofMinutes(1));

        SubmissionReceipt receipt = manager.submit(id);

        assertThat(receipt.getSessionId()).isEqualTo(id);
        assertThat(receipt.getSubmissionId()).isEqualTo(Submission.idFor(id));
        assertThat(receipt.getSubmittedAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));
        assertThat(store.peek(id)).isEmpty();
        assertThat(store.allSubmissions()).singleElement().satisfies(s -> {
            assertThat(s.getAnswers().getSuggestions()).isEqualTo("More colours");
            assertThat(s.getMetadata().getIpAddress()).isEqualTo("10.0.0.1");
            assertThat(s.getSessionCreatedAt()).isEqualTo(START);
        });
        assertThatThrownBy(() -> manager.getStatus(id)).isInstanceOf(SessionNotFoundException.class);
        verify(auditTrail).record(eq(AuditCategory.DATA_MODIFICATION), eq("delete"), eq("session"), anyMap());

        assertThatThrownBy(() -> manager.submit(id)).isInstanceOf(SessionNotFoundException.class);
        assertThat(store.allSubmissions()).hasSize(1);
    }

    @Test
    void submitLosingTheDeleteRaceIsNotFoundWithoutDuplicateRecord() {
        String id = create();
        AtomicBoolean raced = new AtomicBoolean();
        store.setBeforeDelete(() -> {
            if (raced.compareAndSet(false, true)) {
                store.saveSession(store.peek(id).orElseThrow());
            }
        });

        assertThatThrownBy(() -> manager.submit(id)).isInstanceOf(SessionNotFoundException.class);

        assertThat(store.allSubmissions()).hasSize(1);
        assertThat(store.allSubmissions().get(0).getSubmissionId()).isEqualTo(Submission.idFor(id));
    }

    @Test
    void submitCachesRecordAndDropsDerivedEntries() {
        String id = create();
        kv.putRaw("analytics:daily", "{}");
        kv.putRaw("survey:stats", "{}");

        SubmissionReceipt receipt = manager.submit(id);

        assertThat(kv.containsKey("analytics:daily")).isFalse();
        assertThat(kv.containsKey("survey:stats")).isFalse();
        assertThat(kv.containsKey("survey:" + receipt.getSubmissionId())).isTrue();
        assertThat(kv.containsKey("session:" + id)).isFalse();
    }

    @Test
    void statusReadRacingSubmitDoesNotRecacheTheSession() {
        AtomicReference<SessionLifecycleManager> racing = new AtomicReference<>();
        AtomicBoolean raced = new AtomicBoolean();
        InMemoryStoreClient racingStore = new InMemoryStoreClient() {
            @Override
            public Optional<SurveySession> findSession(String sessionId) {
                Optional<SurveySession> seen = super.findSession(sessionId);
                if (seen.isPresent() && raced.compareAndSet(false, true)) {
                    racing.get().submit(sessionId);
                }
                return seen;
            }
        };
        racing.set(newManager(racingStore));
        String id = racing.get().createSession(new ClientMetadata()).getSessionId();
        kv.del("session:" + id);

        assertThat(racing.get().getStatus(id).getStatus()).isEqualTo(SessionStatus.ACTIVE);

        assertThat(racingStore.peek(id)).isEmpty();
        assertThat(kv.containsKey("session:" + id)).isFalse();
        assertThatThrownBy(() -> racing.get().getStatus(id)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void statusReadRacingAbandonDoesNotRecacheActiveCopy() {
        AtomicReference<SessionLifecycleManager> racing = new AtomicReference<>();
        AtomicBoolean raced = new AtomicBoolean();
        InMemoryStoreClient racingStore = new InMemoryStoreClient() {
            @Override
            public Optional<SurveySession> findSession(String sessionId) {
                Optional<SurveySession> seen = super.findSession(sessionId);
                if (seen.isPresent() && raced.compareAndSet(false, true)) {
                    racing.get().abandon(sessionId);
                }
                return seen;
            }
        };
        racing.set(newManager(racingStore));
        String id = racing.get().createSession(new ClientMetadata()).getSessionId();
        kv.del("session:" + id);

        racing.get().getStatus(id);

        assertThat(kv.containsKey("session:" + id)).isFalse();
        assertThat(racing.get().getStatus(id).getStatus()).isEqualTo(SessionStatus.ABANDONED);
    }

    @Test
    void cacheOutageNeverFailsTheLifecycle() {
        kv.setFailing(true);

        String id = create();
        manager.saveProgress(id, 3, SurveyAnswers.builder().phoneBudget("300-500").build());
        assertThat(manager.getStatus(id).getCurrentPage()).isEqualTo(3);
        assertThat(manager.submit(id).getSubmissionId()).isEqualTo(Submission.idFor(id));
    }

    @Test
    void storeOutageSurfacesUnavailable() {
        store.setDown(true);

        assertThatThrownBy(this::create)
                .isInstanceOf(DependencyUnavailableException.class)
                .satisfies(e -> assertThat(((DependencyUnavailableException) e).getCode()).isEqualTo(ErrorCode.UNAVAILABLE));
    }

    @Test
    void abandonedSessionIsTerminal() {
        String id = create();
        clock.advance(Duration.ofMinutes(2));

        manager.abandon(id);

        SessionSnapshot status = manager.getStatus(id);
        assertThat(status.getStatus()).isEqualTo(SessionStatus.ABANDONED);
        assertThat(store.peek(id)).hasValueSatisfying(
                s -> assertThat(s.getAbandonedAt()).isEqualTo(START.plus(Duration.ofMinutes(2))));
        assertThatThrownBy(() -> manager.abandon(id)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> manager.saveProgress(id, 1, null)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> manager.submit(id)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void sweepExpiresOnlyIdleActiveSessions() {
        String idle = create();
        String busy = create();
        clock.advance(Duration.ofMinutes(30));
        manager.saveProgress(busy, 1, null);
        clock.advance(Duration.ofMinutes(40));

        SweepResult first = manager.sweep();
        SweepResult second = manager.sweep();

        assertThat(first.getExpired()).isEqualTo(1);
        assertThat(second.getExpired()).isZero();
        assertThat(manager.getStatus(idle).getStatus()).isEqualTo(SessionStatus.EXPIRED);
        assertThat(store.peek(idle)).hasValueSatisfying(s -> assertThat(s.getExpiredAt()).isEqualTo(clock.instant()));
        assertThat(manager.getStatus(busy).getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void sweepPurgesTerminalSessionsPastThePurgeWindow() {
        String abandoned = create();
        manager.abandon(abandoned);
        String recent = create();
        clock.advance(Duration.ofHours(23));
        manager.saveProgress(recent, 1, null);
        clock.advance(Duration.ofHours(2));

        SweepResult result = manager.sweep();

        assertThat(result.getExpired()).isEqualTo(1);
        assertThat(result.getPurged()).isEqualTo(1);
        assertThat(store.peek(abandoned)).isEmpty();
        assertThat(store.peek(recent)).hasValueSatisfying(s -> assertThat(s.getStatus()).isEqualTo(SessionStatus.EXPIRED));
    }

    @Test
    void statsCountByStatus() {
        create();
        String abandoned = create();
        String submitted = create();
        manager.abandon(abandoned);
        manager.submit(submitted);

        SessionStats stats = manager.stats();

        assertThat(stats.getActiveSessions()).isEqualTo(1);
        assertThat(stats.getAbandonedSessions()).isEqualTo(1);
        assertThat(stats.getCompletedSessions()).isZero();
        assertThat(stats.getSubmissions()).isEqualTo(1);
        assertThat(stats.getRecentSessions()).hasSize(2);
    }
}
