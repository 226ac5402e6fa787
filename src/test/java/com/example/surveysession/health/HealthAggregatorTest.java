package com.example.surveysession.health;

import com.example.surveysession.support.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class HealthAggregatorTest {

    private final TestClock clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final List<HealthAggregator> aggregators = new ArrayList<>();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        aggregators.forEach(HealthAggregator::shutdown);
    }

    private HealthAggregator aggregator(HealthProbe... probes) {
        HealthAggregator aggregator = new HealthAggregator(List.of(probes), Duration.ofMillis(200), clock,
                Executors.newCachedThreadPool());
        aggregators.add(aggregator);
        return aggregator;
    }

    private static HealthProbe fixed(String name, HealthStatus status) {
        return new HealthProbe() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ProbeResult check() {
                return ProbeResult.of(name, status, name + " " + status, Map.of());
            }
        };
    }

    private static HealthProbe throwing(String name) {
        return new HealthProbe() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ProbeResult check() {
                throw new IllegalStateException("probe exploded");
            }
        };
    }

    private HealthProbe hanging(String name) {
        return new HealthProbe() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ProbeResult check() {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ProbeResult.of(name, HealthStatus.HEALTHY, "late", Map.of());
            }
        };
    }

    @Test
    void allHealthyIsHealthy() {
        HealthReport report = aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.HEALTHY),
                fixed(HealthProbe.CACHE, HealthStatus.HEALTHY),
                fixed(HealthProbe.PROCESS, HealthStatus.HEALTHY)).check();

        assertThat(report.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.getSummary().getTotal()).isEqualTo(3);
        assertThat(report.getSummary().getHealthy()).isEqualTo(3);
    }

    @Test
    void aggregateIsWorstOfProbes() {
        HealthReport degraded = aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.HEALTHY),
                fixed(HealthProbe.PROCESS, HealthStatus.DEGRADED)).check();
        HealthReport unhealthy = aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.UNHEALTHY),
                fixed(HealthProbe.PROCESS, HealthStatus.DEGRADED)).check();

        assertThat(degraded.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(unhealthy.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(unhealthy.getSummary().getDegraded()).isEqualTo(1);
        assertThat(unhealthy.getSummary().getUnhealthy()).isEqualTo(1);
    }

    @Test
    void throwingOrHangingProbeOnlyAffectsItself() {
        HealthReport report = aggregator(
                throwing(HealthProbe.DATABASE),
                hanging(HealthProbe.CACHE),
                fixed(HealthProbe.PROCESS, HealthStatus.HEALTHY)).check();

        assertThat(report.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.getChecks()).extracting(ProbeResult::getName, ProbeResult::getStatus)
                .containsExactly(
                        tuple(HealthProbe.DATABASE, HealthStatus.UNHEALTHY),
                        tuple(HealthProbe.CACHE, HealthStatus.UNHEALTHY),
                        tuple(HealthProbe.PROCESS, HealthStatus.HEALTHY));
        assertThat(report.getChecks().get(1).getMessage()).contains("timed out");
    }

    @Test
    void readinessRequiresHealthyDatabaseAndCache() {
        assertThat(aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.HEALTHY),
                fixed(HealthProbe.CACHE, HealthStatus.HEALTHY)).readiness().isReady()).isTrue();
        assertThat(aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.UNHEALTHY),
                fixed(HealthProbe.CACHE, HealthStatus.HEALTHY)).readiness().isReady()).isFalse();
        assertThat(aggregator(
                fixed(HealthProbe.DATABASE, HealthStatus.HEALTHY),
                fixed(HealthProbe.CACHE, HealthStatus.DEGRADED)).readiness().isReady()).isFalse();
    }

    @Test
    void livenessFollowsProcessProbe() {
        assertThat(aggregator(fixed(HealthProbe.PROCESS, HealthStatus.DEGRADED)).liveness().isAlive()).isTrue();
        assertThat(aggregator(fixed(HealthProbe.PROCESS, HealthStatus.UNHEALTHY)).liveness().isAlive()).isFalse();
    }
}
