package com.example.surveysession.health;

import lombok.Value;

import java.time.Instant;

@Value
public class LivenessReport {
    boolean alive;
    Instant timestamp;
    ProbeResult process;
}
