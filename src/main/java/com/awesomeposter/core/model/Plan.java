package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * A revision of the run's plan. Steps are kept in insertion order.
 */
public record Plan(int version, List<PlanStep> steps) implements Serializable {

    public Plan {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static Plan empty() {
        return new Plan(0, List.of());
    }

    public Optional<PlanStep> find(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public boolean contains(String stepId) {
        return find(stepId).isPresent();
    }

    @JsonIgnore
    public List<PlanStep> pendingSteps() {
        return steps.stream().filter(s -> s.status() == StepStatus.PENDING).toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * True when the last step is a completed {@code finalize} and nothing is left to run.
     */
    @JsonIgnore
    public boolean isFinalized() {
        if (steps.isEmpty() || !pendingSteps().isEmpty()) {
            return false;
        }
        PlanStep last = steps.get(steps.size() - 1);
        return last.isFinalize() && last.status() == StepStatus.COMPLETED;
    }
}
