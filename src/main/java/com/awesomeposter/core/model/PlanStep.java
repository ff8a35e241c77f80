package com.awesomeposter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work within a plan: either a capability invocation or a control action.
 *
 * @param id           identifier unique within the plan
 * @param capabilityId capability to invoke (null for control steps)
 * @param action       control action (null for capability steps)
 * @param label        short human-readable label
 * @param status       current lifecycle status
 * @param note         free-text note from the planner or the run loop
 * @param output       facets produced by the step, empty until it completes
 */
public record PlanStep(
    String id,
    String capabilityId,
    ControlAction action,
    String label,
    StepStatus status,
    String note,
    Map<String, Object> output
) implements Serializable {

    public PlanStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plan step id is required");
        }
        if ((capabilityId == null) == (action == null)) {
            throw new IllegalArgumentException(
                    "Plan step " + id + " must reference exactly one of capabilityId or action");
        }
        status = status != null ? status : StepStatus.PENDING;
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }

    public static PlanStep capability(String id, String capabilityId, String label) {
        return new PlanStep(id, capabilityId, null, label, StepStatus.PENDING, null, Map.of());
    }

    public static PlanStep finalizeStep(String id) {
        return new PlanStep(id, null, ControlAction.FINALIZE, "Finalize", StepStatus.PENDING, null, Map.of());
    }

    @JsonIgnore
    public boolean isFinalize() {
        return action == ControlAction.FINALIZE;
    }

    /** Capability id, or the control action's wire name for control steps. */
    @JsonIgnore
    public String target() {
        return capabilityId != null ? capabilityId : action.wireName();
    }

    public PlanStep withStatus(StepStatus newStatus) {
        return new PlanStep(id, capabilityId, action, label, newStatus, note, output);
    }

    public PlanStep withNote(String newNote) {
        return new PlanStep(id, capabilityId, action, label, status, newNote, output);
    }

    public PlanStep withOutput(Map<String, Object> newOutput) {
        return new PlanStep(id, capabilityId, action, label, status, note, newOutput);
    }

    public PlanStep withId(String newId) {
        return new PlanStep(newId, capabilityId, action, label, status, note, output);
    }
}
