package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HitlResponseType {
    OPTION,
    APPROVAL,
    REJECTION,
    FREEFORM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HitlResponseType fromWire(String value) {
        return value == null || value.isBlank() ? null : valueOf(value.trim().toUpperCase());
    }
}
