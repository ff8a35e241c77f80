package com.awesomeposter.core.plan;

import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.model.StepUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanStateMachineTest {

    private final PlanStateMachine machine = new PlanStateMachine();

    private Plan planWith(PlanStep... steps) {
        return machine.apply(Plan.empty(), PlanDelta.adding(steps));
    }

    // -- apply ---------------------------------------------------------------

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("appends new steps in delta order and bumps the version")
        void appendsInOrder() {
            Plan plan = planWith(
                    PlanStep.capability("s1", "strategy", null),
                    PlanStep.capability("g1", "generation", null));

            assertEquals(1, plan.version());
            assertEquals(List.of("s1", "g1"), plan.steps().stream().map(PlanStep::id).toList());
            assertTrue(plan.steps().stream().allMatch(s -> s.status() == StepStatus.PENDING));
        }

        @Test
        @DisplayName("empty delta returns the same plan without a version bump")
        void emptyDeltaKeepsVersion() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            assertSame(plan, machine.apply(plan, PlanDelta.empty()));
        }

        @Test
        @DisplayName("resending the same delta does not duplicate steps")
        void idempotentResend() {
            PlanDelta delta = PlanDelta.adding(PlanStep.capability("s1", "strategy", "Plan"));
            Plan once = machine.apply(Plan.empty(), delta);
            Plan twice = machine.apply(once, delta);

            assertEquals(1, twice.steps().size());
            assertEquals(2, twice.version());
        }

        @Test
        @DisplayName("duplicate id merges note and output, last write wins")
        void duplicateIdMerges() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            PlanStep again = new PlanStep("s1", "strategy", null, "Strategy", null, "focus on B2B",
                    Map.of("draft", "x"));

            Plan merged = machine.apply(plan, PlanDelta.adding(again));

            PlanStep step = merged.find("s1").orElseThrow();
            assertEquals("focus on B2B", step.note());
            assertEquals("Strategy", step.label());
            assertEquals("x", step.output().get("draft"));
        }

        @Test
        @DisplayName("a delta never moves a step backward")
        void dropsBackwardStatus() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            plan = machine.transition(plan, "s1", StepStatus.RUNNING);
            plan = machine.transition(plan, "s1", StepStatus.COMPLETED);

            Plan after = machine.apply(plan, new PlanDelta(List.of(),
                    List.of(new StepUpdate("s1", StepStatus.PENDING, "again", null)), null));

            PlanStep step = after.find("s1").orElseThrow();
            assertEquals(StepStatus.COMPLETED, step.status());
            assertEquals("again", step.note());
        }

        @Test
        @DisplayName("updates for unknown steps are ignored")
        void unknownUpdateIgnored() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            Plan after = machine.apply(plan, new PlanDelta(List.of(),
                    List.of(new StepUpdate("missing", StepStatus.RUNNING, null, null)), null));

            assertEquals(1, after.steps().size());
            assertFalse(after.contains("missing"));
        }
    }

    // -- transition ----------------------------------------------------------

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("pending -> running -> completed keeps the version")
        void forwardPath() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            Plan running = machine.transition(plan, "s1", StepStatus.RUNNING);
            Plan done = machine.transition(running, "s1", StepStatus.COMPLETED, null, Map.of("writerBrief", "b"));

            assertEquals(plan.version(), done.version());
            assertEquals(StepStatus.COMPLETED, done.find("s1").orElseThrow().status());
            assertEquals("b", done.find("s1").orElseThrow().output().get("writerBrief"));
        }

        @Test
        @DisplayName("awaiting_hitl may return to pending")
        void awaitingBackToPending() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            plan = machine.transition(plan, "s1", StepStatus.RUNNING);
            plan = machine.transition(plan, "s1", StepStatus.AWAITING_HITL);
            plan = machine.transition(plan, "s1", StepStatus.PENDING);

            assertEquals(StepStatus.PENDING, plan.find("s1").orElseThrow().status());
        }

        @Test
        @DisplayName("completed -> pending is rejected")
        void backwardRejected() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            Plan done = machine.transition(machine.transition(plan, "s1", StepStatus.RUNNING), "s1", StepStatus.COMPLETED);

            var e = assertThrows(IllegalStepTransitionException.class,
                    () -> machine.transition(done, "s1", StepStatus.PENDING));
            assertTrue(e.getMessage().contains("s1"));
        }

        @Test
        @DisplayName("pending -> completed skips running and is rejected")
        void skipRejected() {
            Plan plan = planWith(PlanStep.capability("s1", "strategy", null));
            assertThrows(IllegalStepTransitionException.class,
                    () -> machine.transition(plan, "s1", StepStatus.COMPLETED));
        }
    }

    // -- scheduling ----------------------------------------------------------

    @Nested
    @DisplayName("scheduling")
    class Scheduling {

        @Test
        @DisplayName("nextRunnable picks the first pending step in insertion order")
        void insertionOrder() {
            Plan plan = planWith(
                    PlanStep.capability("b", "generation", null),
                    PlanStep.capability("a", "strategy", null));

            assertEquals("b", machine.nextRunnable(plan, null).orElseThrow().id());
        }

        @Test
        @DisplayName("nextRunnable prefers a pending preferred step")
        void preferred() {
            Plan plan = planWith(
                    PlanStep.capability("b", "generation", null),
                    PlanStep.capability("a", "strategy", null));

            assertEquals("a", machine.nextRunnable(plan, "a").orElseThrow().id());
            assertEquals("b", machine.nextRunnable(plan, "unknown").orElseThrow().id());
        }

        @Test
        @DisplayName("ensureFinalize appends a finalize step with a unique id")
        void ensureFinalize() {
            Plan plan = planWith(PlanStep.finalizeStep("finalize"));
            plan = machine.transition(machine.transition(plan, "finalize", StepStatus.RUNNING),
                    "finalize", StepStatus.COMPLETED);

            Plan ensured = machine.ensureFinalize(plan);

            PlanStep added = ensured.steps().get(ensured.steps().size() - 1);
            assertEquals("finalize_2", added.id());
            assertTrue(added.isFinalize());
            assertSame(ensured, machine.ensureFinalize(ensured));
        }

        @Test
        @DisplayName("reissue appends a pending copy of a finished step")
        void reissue() {
            Plan plan = planWith(PlanStep.capability("qa", "qa", "Review"));
            plan = machine.transition(machine.transition(plan, "qa", StepStatus.RUNNING), "qa", StepStatus.FAILED);

            Plan reissued = machine.reissue(plan, "qa");

            PlanStep copy = reissued.steps().get(1);
            assertEquals("qa__2", copy.id());
            assertEquals("qa", copy.capabilityId());
            assertEquals(StepStatus.PENDING, copy.status());
            assertEquals("qa__3", machine.reissue(reissued, "qa").steps().get(2).id());
        }

        @Test
        @DisplayName("a plan is finalized once its last step is a completed finalize")
        void finalized() {
            Plan plan = planWith(PlanStep.finalizeStep("finalize"));
            assertFalse(plan.isFinalized());
            plan = machine.transition(machine.transition(plan, "finalize", StepStatus.RUNNING),
                    "finalize", StepStatus.COMPLETED);
            assertTrue(plan.isFinalized());
        }
    }
}
