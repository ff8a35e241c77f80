package com.awesomeposter.core.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Control directives a runtime policy can issue. The set is closed: anything else is
 * rejected when policies are loaded.
 */
public enum ActionType {
    GOTO("goto"),
    REPLAN("replan"),
    HITL("hitl"),
    FAIL("fail"),
    PAUSE("pause"),
    EMIT("emit");

    /** Retired action names and the action that replaced each. */
    static final Map<String, ActionType> LEGACY_ALIASES = Map.of(
            "jump", GOTO,
            "retry", REPLAN,
            "escalate", HITL,
            "abort", FAIL,
            "suspend", PAUSE,
            "notify", EMIT);

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    static ActionType fromWire(String value) {
        for (ActionType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
