package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a run was requested: a full application workflow or a conversational turn.
 */
public enum RunMode {
    APP("app"),
    CHAT("chat");

    private final String wireName;

    RunMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RunMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return APP;
        }
        for (RunMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid mode: " + value);
    }
}
