package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Control actions a plan step can carry instead of a capability reference.
 */
public enum ControlAction {
    FINALIZE("finalize");

    private final String wireName;

    ControlAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ControlAction fromWire(String value) {
        for (ControlAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown control action: " + value);
    }
}
