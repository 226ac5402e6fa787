package com.example.surveysession.health;

/**
 * One dependency or resource check. Implementations report failures in the
 * result; the aggregator also guards against probes that throw or hang.
 */
public interface HealthProbe {
    String DATABASE = "database";
    String CACHE = "cache";
    String PROCESS = "process";

    String name();

    ProbeResult check();
}
