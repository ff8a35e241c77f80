package com.awesomeposter.core.policy;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle conditions a runtime policy can react to.
 */
public enum TriggerKind {
    ON_START("onStart"),
    ON_NODE_COMPLETE("onNodeComplete"),
    ON_VALIDATION_FAIL("onValidationFail"),
    ON_TIMEOUT("onTimeout"),
    ON_METRIC_BELOW("onMetricBelow"),
    MANUAL("manual");

    private final String wireName;

    TriggerKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    static TriggerKind fromWire(String value) {
        for (TriggerKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
