package com.example.surveysession.resilience;

@FunctionalInterface
public interface GuardEventListener {

    GuardEventListener NONE = event -> { };

    void onEvent(GuardEvent event);
}
