package com.example.surveysession.model;

/**
 * Session lifecycle status. ACTIVE is the only non-terminal status and the
 * only one with outgoing transitions.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    EXPIRED,
    ABANDONED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
