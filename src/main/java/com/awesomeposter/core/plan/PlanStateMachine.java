package com.awesomeposter.core.plan;

import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.model.StepUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns planner deltas and step results into plan revisions.
 * <p>
 * Plans are immutable values; every operation returns a new {@link Plan}. Applying a
 * non-empty delta bumps the revision number. Status changes made by the run loop
 * ({@link #transition}) keep the revision and throw on illegal moves, while status
 * changes carried by planner deltas that would move a step backward are dropped, so a
 * resent delta can never rewind execution.
 */
@Component
public class PlanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PlanStateMachine.class);

    static final String FINALIZE_ID = "finalize";

    /**
     * Applies a planner delta.
     * <p>
     * New step ids are appended in delta order. A step id already present merges its label,
     * note and output into the existing step (last write wins); its status is merged only
     * when the move is legal. Updates for unknown ids are ignored.
     */
    public Plan apply(Plan plan, PlanDelta delta) {
        if (delta == null || delta.isEmpty()) {
            return plan;
        }

        Map<String, PlanStep> steps = new LinkedHashMap<>();
        for (PlanStep step : plan.steps()) {
            steps.put(step.id(), step);
        }

        for (PlanStep added : delta.stepsAdd()) {
            PlanStep existing = steps.get(added.id());
            if (existing == null) {
                steps.put(added.id(), added);
            } else {
                steps.put(added.id(), merge(existing, added));
            }
        }

        for (StepUpdate update : delta.stepsUpdate()) {
            PlanStep existing = steps.get(update.id());
            if (existing == null) {
                log.warn("Ignoring update for unknown step {}", update.id());
                continue;
            }
            PlanStep updated = existing;
            if (update.status() != null) {
                updated = mergeStatus(updated, update.status());
            }
            if (update.note() != null) {
                updated = updated.withNote(update.note());
            }
            if (update.output() != null && !update.output().isEmpty()) {
                updated = updated.withOutput(update.output());
            }
            steps.put(update.id(), updated);
        }

        return new Plan(plan.version() + 1, new ArrayList<>(steps.values()));
    }

    /**
     * Moves one step to a new status, optionally recording a note and output.
     *
     * @throws IllegalStepTransitionException if the move is not allowed
     * @throws IllegalArgumentException if the step does not exist
     */
    public Plan transition(Plan plan, String stepId, StepStatus to, String note, Map<String, Object> output) {
        PlanStep current = plan.find(stepId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown step: " + stepId));
        if (!current.status().canTransitionTo(to)) {
            throw new IllegalStepTransitionException(stepId, current.status(), to);
        }
        PlanStep next = current.withStatus(to);
        if (note != null) {
            next = next.withNote(note);
        }
        if (output != null) {
            next = next.withOutput(output);
        }
        return replace(plan, next);
    }

    public Plan transition(Plan plan, String stepId, StepStatus to) {
        return transition(plan, stepId, to, null, null);
    }

    /**
     * The step to run next: {@code preferredId} when it is pending, otherwise the first
     * pending step in insertion order.
     */
    public Optional<PlanStep> nextRunnable(Plan plan, String preferredId) {
        if (preferredId != null) {
            Optional<PlanStep> preferred = plan.find(preferredId)
                    .filter(s -> s.status() == StepStatus.PENDING);
            if (preferred.isPresent()) {
                return preferred;
            }
        }
        return plan.pendingSteps().stream().findFirst();
    }

    /**
     * Appends a pending {@code finalize} step unless one is already pending.
     */
    public Plan ensureFinalize(Plan plan) {
        boolean pendingFinalize = plan.steps().stream()
                .anyMatch(s -> s.isFinalize() && s.status() == StepStatus.PENDING);
        if (pendingFinalize) {
            return plan;
        }
        String id = uniqueId(plan, FINALIZE_ID);
        List<PlanStep> steps = new ArrayList<>(plan.steps());
        steps.add(PlanStep.finalizeStep(id));
        return new Plan(plan.version() + 1, steps);
    }

    /**
     * Re-issues a finished step as a new pending step so control can jump back to it.
     *
     * @return the new plan; the new step is the last one
     */
    public Plan reissue(Plan plan, String stepId) {
        PlanStep source = plan.find(stepId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown step: " + stepId));
        PlanStep copy = new PlanStep(uniqueId(plan, stepId + "__"), source.capabilityId(), source.action(),
                source.label(), StepStatus.PENDING, "Re-issued from " + stepId, Map.of());
        List<PlanStep> steps = new ArrayList<>(plan.steps());
        steps.add(copy);
        return new Plan(plan.version() + 1, steps);
    }

    /**
     * Returns {@code base} when unused, otherwise the first {@code base + n} (n from 2) not in the plan.
     */
    static String uniqueId(Plan plan, String base) {
        if (!base.endsWith("__") && !plan.contains(base)) {
            return base;
        }
        String prefix = base.endsWith("__") ? base : base + "_";
        int n = 2;
        while (plan.contains(prefix + n)) {
            n++;
        }
        return prefix + n;
    }

    private PlanStep merge(PlanStep existing, PlanStep incoming) {
        PlanStep merged = mergeStatus(existing, incoming.status());
        if (incoming.label() != null) {
            merged = new PlanStep(merged.id(), merged.capabilityId(), merged.action(), incoming.label(),
                    merged.status(), merged.note(), merged.output());
        }
        if (incoming.note() != null) {
            merged = merged.withNote(incoming.note());
        }
        if (!incoming.output().isEmpty()) {
            merged = merged.withOutput(incoming.output());
        }
        return merged;
    }

    private PlanStep mergeStatus(PlanStep existing, StepStatus incoming) {
        if (incoming == null || incoming == existing.status()) {
            return existing;
        }
        if (!existing.status().canTransitionTo(incoming)) {
            log.debug("Dropping status change {} -> {} for step {} from planner delta",
                    existing.status().wireName(), incoming.wireName(), existing.id());
            return existing;
        }
        return existing.withStatus(incoming);
    }

    private Plan replace(Plan plan, PlanStep step) {
        List<PlanStep> steps = new ArrayList<>(plan.steps().size());
        for (PlanStep s : plan.steps()) {
            steps.add(s.id().equals(step.id()) ? step : s);
        }
        return new Plan(plan.version(), steps);
    }
}
