package com.awesomeposter.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of run lifecycle event types. The wire name is the SSE {@code event:} field.
 */
public enum EventType {
    START("start"),
    PHASE("phase"),
    PROGRESS("progress"),
    MESSAGE("message"),
    METRICS("metrics"),
    COMPLETE("complete"),
    ERROR("error"),
    LOG("log");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
