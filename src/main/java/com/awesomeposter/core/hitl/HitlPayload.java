package com.awesomeposter.core.hitl;

import java.io.Serializable;
import java.util.List;

/**
 * What a capability asks the human.
 *
 * @param question          the question text, required
 * @param kind              question, approval or choice (defaults to question)
 * @param options           choices offered; a choice request needs at least one
 * @param allowFreeForm     whether a free-text answer is accepted
 * @param urgency           defaults to normal
 * @param additionalContext optional context shown with the question
 */
public record HitlPayload(
    String question,
    HitlKind kind,
    List<HitlOption> options,
    boolean allowFreeForm,
    HitlUrgency urgency,
    String additionalContext
) implements Serializable {

    public HitlPayload {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("HITL question is required");
        }
        kind = kind != null ? kind : HitlKind.QUESTION;
        options = options != null ? List.copyOf(options) : List.of();
        urgency = urgency != null ? urgency : HitlUrgency.NORMAL;
        if (kind == HitlKind.CHOICE && options.isEmpty()) {
            throw new IllegalArgumentException("A choice request needs at least one option");
        }
    }

    public static HitlPayload approval(String question) {
        return new HitlPayload(question, HitlKind.APPROVAL, List.of(), false, HitlUrgency.NORMAL, null);
    }
}
