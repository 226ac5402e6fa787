package com.example.surveysession.health;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every {@link HealthProbe} concurrently and folds the results.
 *
 * <p>Probes are isolated from each other: one that throws or misses the probe
 * deadline is reported UNHEALTHY on its own, the others are unaffected.</p>
 */
@Service
public class HealthAggregator {

    private static final Logger logger = LoggerFactory.getLogger(HealthAggregator.class);

    private final List<HealthProbe> probes;
    private final Duration probeTimeout;
    private final Clock clock;
    private final ExecutorService executor;

    @Autowired
    public HealthAggregator(List<HealthProbe> probes,
                            @Value("${app.health.probe-timeout:3s}") Duration probeTimeout,
                            Clock clock) {
        this(probes, probeTimeout, clock, createExecutorService());
    }

    public HealthAggregator(List<HealthProbe> probes, Duration probeTimeout, Clock clock, ExecutorService executor) {
        this.probes = List.copyOf(probes);
        this.probeTimeout = probeTimeout;
        this.clock = clock;
        this.executor = executor;
    }

    private static ExecutorService createExecutorService() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HealthReport check() {
        long start = System.nanoTime();
        List<ProbeResult> results = runAll(probes);

        HealthStatus overall = HealthStatus.HEALTHY;
        long healthy = 0;
        long degraded = 0;
        long unhealthy = 0;
        for (ProbeResult result : results) {
            overall = HealthStatus.worstOf(overall, result.getStatus());
            switch (result.getStatus()) {
                case HEALTHY:
                    healthy++;
                    break;
                case DEGRADED:
                    degraded++;
                    break;
                default:
                    unhealthy++;
            }
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (overall != HealthStatus.HEALTHY) {
            logger.info("Health check {}: {} degraded, {} unhealthy", overall, degraded, unhealthy);
        }
        return new HealthReport(overall, clock.instant(), elapsedMs, results,
                new HealthReport.Summary(results.size(), healthy, degraded, unhealthy));
    }

    /**
     * Ready only when both the database and the cache probes are HEALTHY.
     */
    public ReadinessReport readiness() {
        List<HealthProbe> required = new ArrayList<>();
        probe(HealthProbe.DATABASE).ifPresent(required::add);
        probe(HealthProbe.CACHE).ifPresent(required::add);
        List<ProbeResult> results = runAll(required);
        boolean ready = required.size() == 2
                && results.stream().allMatch(r -> r.getStatus() == HealthStatus.HEALTHY);
        return new ReadinessReport(ready, clock.instant(), results);
    }

    public LivenessReport liveness() {
        ProbeResult process = probe(HealthProbe.PROCESS)
                .map(p -> runAll(List.of(p)).get(0))
                .orElseGet(() -> ProbeResult.of(HealthProbe.PROCESS, HealthStatus.HEALTHY, "No process probe", Map.of()));
        return new LivenessReport(process.getStatus() != HealthStatus.UNHEALTHY, clock.instant(), process);
    }

    private Optional<HealthProbe> probe(String name) {
        return probes.stream().filter(p -> name.equals(p.name())).findFirst();
    }

    private List<ProbeResult> runAll(List<HealthProbe> selected) {
        List<CompletableFuture<ProbeResult>> futures = new ArrayList<>();
        for (HealthProbe probe : selected) {
            futures.add(CompletableFuture.supplyAsync(probe::check, executor)
                    .completeOnTimeout(ProbeResult.unhealthy(probe.name(),
                                    probe.name() + " check timed out after " + probeTimeout.toMillis() + "ms", Map.of()),
                            probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        logger.warn("Health probe {} failed", probe.name(), e);
                        return ProbeResult.unhealthy(probe.name(), probe.name() + " check failed",
                                Map.of("error", String.valueOf(e.getMessage())));
                    }));
        }
        List<ProbeResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ProbeResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
