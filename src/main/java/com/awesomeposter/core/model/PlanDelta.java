package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/**
 * Planner output: steps to add and updates to existing steps.
 */
public record PlanDelta(
    List<PlanStep> stepsAdd,
    List<StepUpdate> stepsUpdate,
    String note
) implements Serializable {

    public PlanDelta {
        stepsAdd = stepsAdd != null ? List.copyOf(stepsAdd) : List.of();
        stepsUpdate = stepsUpdate != null ? List.copyOf(stepsUpdate) : List.of();
    }

    public static PlanDelta empty() {
        return new PlanDelta(List.of(), List.of(), null);
    }

    public static PlanDelta adding(PlanStep... steps) {
        return new PlanDelta(List.of(steps), List.of(), null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return stepsAdd.isEmpty() && stepsUpdate.isEmpty();
    }
}
