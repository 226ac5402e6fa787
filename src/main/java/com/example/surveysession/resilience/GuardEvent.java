package com.example.surveysession.resilience;

import lombok.Value;

import java.time.Instant;

@Value
public class GuardEvent {

    public enum Type {
        CIRCUIT_OPENED,
        CIRCUIT_CLOSED,
        RETRIES_EXHAUSTED
    }

    String guardName;
    Type type;
    String operation;
    String message;
    Instant timestamp;
}
