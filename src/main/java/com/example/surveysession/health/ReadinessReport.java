package com.example.surveysession.health;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ReadinessReport {
    boolean ready;
    Instant timestamp;
    List<ProbeResult> checks;
}
