package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HitlUrgency {
    LOW,
    NORMAL,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HitlUrgency fromWire(String value) {
        return value == null || value.isBlank() ? NORMAL : valueOf(value.trim().toUpperCase());
    }
}
