package com.awesomeposter.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a run ended. Only {@link #ERROR} is reported through an {@code error} event; every
 * other outcome travels in the {@code complete} event.
 */
public enum RunOutcome {
    COMPLETED("completed"),
    PENDING_HITL("pending_hitl"),
    PAUSED("paused"),
    FAILED("failed"),
    ERROR("error");

    private final String wireName;

    RunOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
