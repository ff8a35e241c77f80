package com.awesomeposter.core.planner;

import com.awesomeposter.core.model.ControlAction;
import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.model.StepUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns loose planner output into a {@link PlanDelta}.
 * <p>
 * Accepts common spellings for the finalize action and for statuses, gives id-less steps
 * an {@code auto_<target>_<n>} id, and drops steps that reference unknown capabilities.
 */
@Component
public class PlanDeltaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PlanDeltaNormalizer.class);

    /** Default capability order when the planner gives nothing usable for a fresh plan. */
    static final List<String> FALLBACK_ORDER = List.of("strategy", "generation", "qa");

    private static final Set<String> FINALIZE_ALIASES = Set.of("finalize", "finalise", "final", "finish", "complete", "done");

    private static final Map<String, StepStatus> STATUS_ALIASES = Map.ofEntries(
            Map.entry("pending", StepStatus.PENDING),
            Map.entry("todo", StepStatus.PENDING),
            Map.entry("queued", StepStatus.PENDING),
            Map.entry("planned", StepStatus.PENDING),
            Map.entry("running", StepStatus.RUNNING),
            Map.entry("in_progress", StepStatus.RUNNING),
            Map.entry("active", StepStatus.RUNNING),
            Map.entry("completed", StepStatus.COMPLETED),
            Map.entry("complete", StepStatus.COMPLETED),
            Map.entry("done", StepStatus.COMPLETED),
            Map.entry("succeeded", StepStatus.COMPLETED),
            Map.entry("failed", StepStatus.FAILED),
            Map.entry("error", StepStatus.FAILED),
            Map.entry("awaiting_hitl", StepStatus.AWAITING_HITL),
            Map.entry("waiting", StepStatus.AWAITING_HITL));

    public PlanDelta normalize(PlannerOutput output, Plan plan, Set<String> capabilityIds) {
        if (output == null) {
            return PlanDelta.empty();
        }
        Set<String> usedIds = new HashSet<>();
        plan.steps().forEach(s -> usedIds.add(s.id()));

        List<PlanStep> adds = new ArrayList<>();
        if (output.stepsAdd() != null) {
            for (PlannerOutput.ProposedStep proposed : output.stepsAdd()) {
                PlanStep step = toStep(proposed, capabilityIds, usedIds);
                if (step != null) {
                    adds.add(step);
                }
            }
        }

        List<StepUpdate> updates = new ArrayList<>();
        if (output.stepsUpdate() != null) {
            for (PlannerOutput.ProposedUpdate proposed : output.stepsUpdate()) {
                if (proposed.id() == null || proposed.id().isBlank()) {
                    continue;
                }
                updates.add(new StepUpdate(proposed.id(), status(proposed.status()), proposed.note(), null));
            }
        }
        return new PlanDelta(adds, updates, output.note());
    }

    /**
     * The default strategy, generation and qa sequence, limited to registered capabilities.
     */
    public PlanDelta fallback(Set<String> capabilityIds) {
        List<PlanStep> steps = FALLBACK_ORDER.stream()
                .filter(capabilityIds::contains)
                .map(id -> PlanStep.capability(id, id, null))
                .toList();
        return new PlanDelta(steps, List.of(), "Fallback plan");
    }

    private PlanStep toStep(PlannerOutput.ProposedStep proposed, Set<String> capabilityIds, Set<String> usedIds) {
        String target = firstNonBlank(proposed.action(), proposed.capabilityId());
        if (target == null) {
            log.warn("Dropping planner step without capability or action: {}", proposed);
            return null;
        }
        boolean finalize = FINALIZE_ALIASES.contains(target.trim().toLowerCase());
        if (!finalize && !capabilityIds.contains(target)) {
            log.warn("Dropping planner step for unknown capability '{}'", target);
            return null;
        }
        String id = proposed.id();
        if (id == null || id.isBlank()) {
            id = autoId(finalize ? ControlAction.FINALIZE.wireName() : target, usedIds);
        }
        usedIds.add(id);
        StepStatus status = proposed.status() != null ? status(proposed.status()) : null;
        return new PlanStep(id,
                finalize ? null : target,
                finalize ? ControlAction.FINALIZE : null,
                proposed.label(),
                status,
                proposed.note(),
                Map.of());
    }

    private static String autoId(String base, Set<String> usedIds) {
        int n = 1;
        while (usedIds.contains("auto_" + base + "_" + n)) {
            n++;
        }
        return "auto_" + base + "_" + n;
    }

    private static StepStatus status(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        StepStatus status = STATUS_ALIASES.get(raw.trim().toLowerCase().replace('-', '_').replace(' ', '_'));
        if (status == null) {
            log.warn("Ignoring unknown planner status '{}'", raw);
        }
        return status;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return b != null && !b.isBlank() ? b.trim() : null;
    }
}
