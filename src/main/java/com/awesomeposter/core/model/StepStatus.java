package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a plan step.
 * <p>
 * Steps move forward only: {@code pending -> running -> completed | failed | awaiting_hitl}.
 * A step waiting on a human goes back to {@code pending} when the request is resolved,
 * or to {@code failed} when it is denied. That is the only backward move.
 */
public enum StepStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    AWAITING_HITL("awaiting_hitl");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static StepStatus fromWire(String value) {
        for (StepStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a step in this status may move to {@code next}. Staying put is always allowed.
     */
    public boolean canTransitionTo(StepStatus next) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED || next == AWAITING_HITL;
            case AWAITING_HITL -> next == PENDING || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
