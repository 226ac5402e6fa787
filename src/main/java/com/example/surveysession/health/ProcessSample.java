package com.example.surveysession.health;

import lombok.Value;

import java.time.Duration;

@Value
public class ProcessSample {
    long heapUsedBytes;
    long heapMaxBytes;
    double systemLoadAverage;
    int availableProcessors;
    Duration uptime;

    public double heapUsagePercent() {
        return heapMaxBytes <= 0 ? 0 : heapUsedBytes * 100.0 / heapMaxBytes;
    }

    /**
     * One-minute load per core, as a percentage; negative when the platform has no load average.
     */
    public double loadPercent() {
        if (systemLoadAverage < 0 || availableProcessors <= 0) {
            return -1;
        }
        return systemLoadAverage * 100.0 / availableProcessors;
    }
}
