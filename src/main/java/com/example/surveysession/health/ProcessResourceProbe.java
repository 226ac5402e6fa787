package com.example.surveysession.health;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Heap, system load and uptime of this JVM.
 */
@Component
public class ProcessResourceProbe implements HealthProbe {

    private static final long MB = 1024 * 1024;

    private final Supplier<ProcessSample> sampler;
    private final double memoryDegradedPercent;
    private final double memoryUnhealthyPercent;
    private final double loadDegradedPercent;
    private final Duration minUptime;

    @Autowired
    public ProcessResourceProbe(@Value("${app.health.memory-degraded-percent:85}") double memoryDegradedPercent,
                                @Value("${app.health.memory-unhealthy-percent:98}") double memoryUnhealthyPercent,
                                @Value("${app.health.load-degraded-percent:80}") double loadDegradedPercent,
                                @Value("${app.health.min-uptime:60s}") Duration minUptime) {
        this(ProcessResourceProbe::sampleJvm, memoryDegradedPercent, memoryUnhealthyPercent, loadDegradedPercent, minUptime);
    }

    public ProcessResourceProbe(Supplier<ProcessSample> sampler, double memoryDegradedPercent,
                                double memoryUnhealthyPercent, double loadDegradedPercent, Duration minUptime) {
        this.sampler = sampler;
        this.memoryDegradedPercent = memoryDegradedPercent;
        this.memoryUnhealthyPercent = memoryUnhealthyPercent;
        this.loadDegradedPercent = loadDegradedPercent;
        this.minUptime = minUptime;
    }

    static ProcessSample sampleJvm() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return new ProcessSample(
                heap.getUsed(),
                max,
                ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage(),
                Runtime.getRuntime().availableProcessors(),
                Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime()));
    }

    @Override
    public String name() {
        return PROCESS;
    }

    @Override
    public ProbeResult check() {
        ProcessSample sample = sampler.get();
        double heapPercent = sample.heapUsagePercent();
        double loadPercent = sample.loadPercent();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("heapUsedMb", sample.getHeapUsedBytes() / MB);
        details.put("heapMaxMb", sample.getHeapMaxBytes() / MB);
        details.put("heapUsagePercent", Math.round(heapPercent));
        details.put("cores", sample.getAvailableProcessors());
        if (loadPercent >= 0) {
            details.put("loadPercent", Math.round(loadPercent));
        }
        details.put("uptimeSeconds", sample.getUptime().toSeconds());

        if (heapPercent >= memoryUnhealthyPercent) {
            return ProbeResult.of(PROCESS, HealthStatus.UNHEALTHY, "Heap nearly exhausted", details);
        }
        boolean degraded = heapPercent >= memoryDegradedPercent
                || loadPercent >= loadDegradedPercent
                || sample.getUptime().compareTo(minUptime) < 0;
        return degraded
                ? ProbeResult.of(PROCESS, HealthStatus.DEGRADED, "Process is degraded", details)
                : ProbeResult.of(PROCESS, HealthStatus.HEALTHY, "Process is healthy", details);
    }
}
