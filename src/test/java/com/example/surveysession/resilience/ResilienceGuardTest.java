package com.example.surveysession.resilience;

import com.example.surveysession.error.DependencyUnavailableException;
import com.example.surveysession.error.ErrorCode;
import com.example.surveysession.error.OperationTimeoutException;
import com.example.surveysession.error.SessionNotFoundException;
import com.example.surveysession.support.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilienceGuardTest {

    private TestClock clock;
    private List<Long> sleeps;
    private List<GuardEvent> events;
    private ResilienceGuard guard;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
        sleeps = new ArrayList<>();
        events = new ArrayList<>();
        guard = newGuard(3, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        guard.shutdown();
    }

    private ResilienceGuard newGuard(int maxAttempts, Duration timeout) {
        GuardSettings settings = GuardSettings.builder()
                .failureThreshold(5)
                .cooldown(Duration.ofSeconds(60))
                .maxAttempts(maxAttempts)
                .baseBackoff(Duration.ofMillis(200))
                .maxBackoff(Duration.ofSeconds(5))
                .timeout(timeout)
                .build();
        ResilienceGuard g = new ResilienceGuard("store", settings, clock, Executors.newCachedThreadPool(),
                sleeps::add, ResilienceGuard.DEFAULT_PASS_THROUGH);
        g.setListener(events::add);
        return g;
    }

    @Test
    void returnsResultOnSuccess() {
        assertThat(guard.execute("find", () -> "ok", true)).isEqualTo("ok");
        assertThat(guard.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void retriesRetrySafeCallsWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = guard.execute("find", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
            return "third time";
        }, true);

        assertThat(result).isEqualTo("third time");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(200L, 400L);
    }

    @Test
    void doesNotRetryUnsafeCalls() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> guard.execute("insert", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        }, false))
                .isInstanceOf(DependencyUnavailableException.class)
                .satisfies(e -> assertThat(((DependencyUnavailableException) e).getCode()).isEqualTo(ErrorCode.UNAVAILABLE));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void exhaustedRetriesPublishEvent() {
        assertThatThrownBy(() -> guard.execute("find", () -> {
            throw new IllegalStateException("down");
        }, true)).isInstanceOf(DependencyUnavailableException.class);

        assertThat(events).extracting(GuardEvent::getType).containsExactly(GuardEvent.Type.RETRIES_EXHAUSTED);
        assertThat(guard.getCircuitBreaker().getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    void slowAttemptIsReportedAsTimeout() throws Exception {
        ResilienceGuard slow = newGuard(1, Duration.ofMillis(50));
        CountDownLatch release = new CountDownLatch(1);
        try {
            assertThatThrownBy(() -> slow.execute("find", () -> {
                release.await(5, TimeUnit.SECONDS);
                return "late";
            }, true))
                    .isInstanceOf(OperationTimeoutException.class)
                    .satisfies(e -> {
                        OperationTimeoutException timeout = (OperationTimeoutException) e;
                        assertThat(timeout.getCode()).isEqualTo(ErrorCode.TIMEOUT);
                        assertThat(timeout.getRetryAfter()).isGreaterThanOrEqualTo(Duration.ofSeconds(1));
                    });
        } finally {
            release.countDown();
            slow.shutdown();
        }
    }

    @Test
    void openCircuitRejectsWithoutInvoking() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute("find", () -> {
                throw new IllegalStateException("down");
            }, true)).isInstanceOf(DependencyUnavailableException.class);
        }
        assertThat(guard.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(events).extracting(GuardEvent::getType).contains(GuardEvent.Type.CIRCUIT_OPENED);

        int eventsBefore = events.size();

        AtomicInteger calls = new AtomicInteger();
        for (int i = 0; i < 50; i++) {
            assertThatThrownBy(() -> guard.execute("find", () -> calls.incrementAndGet(), true))
                    .isInstanceOf(DependencyUnavailableException.class)
                    .hasMessageContaining("circuit OPEN")
                    .satisfies(e -> assertThat(((DependencyUnavailableException) e).getRetryAfter())
                            .isEqualTo(Duration.ofSeconds(60)));
        }
        assertThat(calls.get()).isZero();
        assertThat(events).hasSize(eventsBefore);
    }

    @Test
    void rejectionDuringTrialNamesHalfOpenState() throws Exception {
        openBreaker();
        clock.advance(Duration.ofSeconds(61));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread trial = new Thread(() -> guard.execute("trial", () -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        }, true));
        trial.start();
        try {
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> guard.execute("find", () -> "second", true))
                    .isInstanceOf(DependencyUnavailableException.class)
                    .hasMessageContaining("circuit HALF_OPEN");
        } finally {
            release.countDown();
            trial.join(5000);
        }
    }

    @Test
    void recoversThroughHalfOpenTrial() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute("find", () -> {
                throw new IllegalStateException("down");
            }, true)).isInstanceOf(DependencyUnavailableException.class);
        }
        clock.advance(Duration.ofSeconds(61));

        assertThat(guard.execute("find", () -> "back", true)).isEqualTo("back");
        assertThat(guard.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(events).extracting(GuardEvent::getType).containsSubsequence(
                GuardEvent.Type.CIRCUIT_OPENED, GuardEvent.Type.CIRCUIT_CLOSED);
    }

    @Test
    void interruptedTrialCallReleasesThePermit() throws Exception {
        openBreaker();
        clock.advance(Duration.ofSeconds(61));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread trial = new Thread(() -> {
            try {
                guard.execute("trial", () -> {
                    started.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return "late";
                }, true);
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        try {
            trial.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            trial.interrupt();
            trial.join(5000);

            assertThat(failure.get()).isInstanceOf(DependencyUnavailableException.class)
                    .hasMessageContaining("interrupted");

            clock.advance(Duration.ofHours(1));
            AtomicInteger calls = new AtomicInteger();
            assertThat(guard.execute("later", calls::incrementAndGet, true)).isEqualTo(1);
            assertThat(guard.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
        } finally {
            release.countDown();
        }
    }

    private void openBreaker() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute("find", () -> {
                throw new IllegalStateException("down");
            }, true)).isInstanceOf(DependencyUnavailableException.class);
        }
        assertThat(guard.getCircuitBreaker().getState()).isEqualTo(CircuitBreakerState.OPEN);
    }
}
