package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HitlKind {
    QUESTION,
    APPROVAL,
    CHOICE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HitlKind fromWire(String value) {
        return value == null || value.isBlank() ? QUESTION : valueOf(value.trim().toUpperCase());
    }
}
