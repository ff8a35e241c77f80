package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a human-in-the-loop request. Only {@code PENDING} can change.
 */
public enum HitlStatus {
    PENDING,
    RESOLVED,
    DENIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HitlStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
