package com.awesomeposter.core.planner;

import com.awesomeposter.core.model.ControlAction;
import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanDeltaNormalizerTest {

    private static final Set<String> CAPABILITIES = Set.of("strategy", "generation", "qa");

    private final PlanDeltaNormalizer normalizer = new PlanDeltaNormalizer();

    private static PlannerOutput.ProposedStep step(String id, String capabilityId, String action, String status) {
        return new PlannerOutput.ProposedStep(id, capabilityId, action, null, status, null);
    }

    @Test
    @DisplayName("null output is an empty delta")
    void nullOutput() {
        assertTrue(normalizer.normalize(null, Plan.empty(), CAPABILITIES).isEmpty());
    }

    @Test
    @DisplayName("finalize spellings become a finalize control step")
    void finalizeAliases() {
        for (String alias : List.of("finalize", "Finalise", "final", "finish", "complete", "done")) {
            PlanDelta delta = normalizer.normalize(
                    new PlannerOutput(List.of(step("end", null, alias, null)), null, null), Plan.empty(), CAPABILITIES);

            PlanStep added = delta.stepsAdd().get(0);
            assertEquals(ControlAction.FINALIZE, added.action(), alias);
            assertNull(added.capabilityId());
        }
    }

    @Test
    @DisplayName("id-less steps get auto ids that avoid existing ones")
    void autoIds() {
        Plan plan = new Plan(1, List.of(PlanStep.capability("auto_generation_1", "generation", null)));

        PlanDelta delta = normalizer.normalize(new PlannerOutput(List.of(
                step(null, "generation", null, null),
                step(" ", "generation", null, null),
                step(null, null, "finalize", null)), null, null), plan, CAPABILITIES);

        assertEquals(List.of("auto_generation_2", "auto_generation_3", "auto_finalize_1"),
                delta.stepsAdd().stream().map(PlanStep::id).toList());
    }

    @Test
    @DisplayName("unknown capabilities and empty targets are dropped")
    void unknownDropped() {
        PlanDelta delta = normalizer.normalize(new PlannerOutput(List.of(
                step("x", "translation", null, null),
                step("y", null, null, null),
                step("s", "strategy", null, null)), null, "why"), Plan.empty(), CAPABILITIES);

        assertEquals(List.of("s"), delta.stepsAdd().stream().map(PlanStep::id).toList());
        assertEquals("why", delta.note());
    }

    @Test
    @DisplayName("status aliases map to canonical statuses; unknown ones are ignored")
    void statusAliases() {
        PlanDelta delta = normalizer.normalize(new PlannerOutput(null, List.of(
                new PlannerOutput.ProposedUpdate("a", "In-Progress", null),
                new PlannerOutput.ProposedUpdate("b", "done", "ok"),
                new PlannerOutput.ProposedUpdate("c", "todo", null),
                new PlannerOutput.ProposedUpdate("d", "waiting", null),
                new PlannerOutput.ProposedUpdate("e", "exploded", "note kept"),
                new PlannerOutput.ProposedUpdate(null, "done", null)), null), Plan.empty(), CAPABILITIES);

        assertEquals(5, delta.stepsUpdate().size());
        assertEquals(StepStatus.RUNNING, delta.stepsUpdate().get(0).status());
        assertEquals(StepStatus.COMPLETED, delta.stepsUpdate().get(1).status());
        assertEquals(StepStatus.PENDING, delta.stepsUpdate().get(2).status());
        assertEquals(StepStatus.AWAITING_HITL, delta.stepsUpdate().get(3).status());
        assertNull(delta.stepsUpdate().get(4).status());
        assertEquals("note kept", delta.stepsUpdate().get(4).note());
    }

    @Test
    @DisplayName("fallback is strategy, generation, qa limited to what is registered")
    void fallback() {
        PlanDelta full = normalizer.fallback(CAPABILITIES);
        PlanDelta partial = normalizer.fallback(Set.of("qa", "strategy"));

        assertEquals(List.of("strategy", "generation", "qa"), full.stepsAdd().stream().map(PlanStep::id).toList());
        assertEquals(List.of("strategy", "qa"), partial.stepsAdd().stream().map(PlanStep::capabilityId).toList());
        assertEquals("Fallback plan", full.note());
    }
}
