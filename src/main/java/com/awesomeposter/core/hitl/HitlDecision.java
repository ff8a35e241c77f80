package com.awesomeposter.core.hitl;

/**
 * Follow-up a responder can attach to a response through {@code metadata.action}.
 */
public enum HitlDecision {
    /** End the run as failed. */
    FAIL,
    /** Surface the response as an event and carry on. */
    EMIT,
    /** Carry on ({@code resume} or {@code continue}). */
    RESUME;

    static HitlDecision fromAction(Object action) {
        if (!(action instanceof String text)) {
            return null;
        }
        return switch (text.trim().toLowerCase()) {
            case "fail" -> FAIL;
            case "emit" -> EMIT;
            case "resume", "continue" -> RESUME;
            default -> null;
        };
    }
}
