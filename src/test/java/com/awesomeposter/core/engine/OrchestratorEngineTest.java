package com.awesomeposter.core.engine;

import com.awesomeposter.core.capability.Capability;
import com.awesomeposter.core.capability.CapabilityContext;
import com.awesomeposter.core.capability.CapabilityRegistration;
import com.awesomeposter.core.capability.CapabilityRegistry;
import com.awesomeposter.core.capability.CapabilityResult;
import com.awesomeposter.core.events.EventBus;
import com.awesomeposter.core.events.EventType;
import com.awesomeposter.core.events.RunEvent;
import com.awesomeposter.core.guard.GuardDefinition;
import com.awesomeposter.core.guard.GuardEvaluator;
import com.awesomeposter.core.hitl.HitlGate;
import com.awesomeposter.core.hitl.HitlKind;
import com.awesomeposter.core.hitl.HitlOption;
import com.awesomeposter.core.hitl.HitlPayload;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.hitl.HitlUrgency;
import com.awesomeposter.core.metrics.OrchestratorMetrics;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.persistence.CheckpointResumeStore;
import com.awesomeposter.core.persistence.RunSnapshot;
import com.awesomeposter.core.plan.PlanStateMachine;
import com.awesomeposter.core.planner.Planner;
import com.awesomeposter.core.policy.LegacyPolicyActionException;
import com.awesomeposter.core.policy.RuntimePolicyEvaluator;
import com.awesomeposter.core.policy.RuntimePolicyParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorEngineTest {

    private final GuardEvaluator guardEvaluator = new GuardEvaluator();
    private final Deque<PlanDelta> plannerScript = new ArrayDeque<>();
    private final AtomicInteger plannerCalls = new AtomicInteger();
    private final Planner planner = context -> {
        plannerCalls.incrementAndGet();
        return plannerScript.isEmpty() ? PlanDelta.empty() : plannerScript.poll();
    };

    private SimpleMeterRegistry meterRegistry;
    private CheckpointResumeStore store;
    private EventBus eventBus;
    private OrchestratorProperties properties;
    private CapabilityRegistry registry;
    private List<RunEvent> events;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new CheckpointResumeStore(new MemorySaver(), new ObjectMapper().findAndRegisterModules());
        eventBus = new EventBus();
        properties = new OrchestratorProperties();
        registry = new CapabilityRegistry();
        events = new ArrayList<>();
    }

    private OrchestratorEngine engine() {
        return new OrchestratorEngine(planner, new PlanStateMachine(), registry, guardEvaluator,
                new RuntimePolicyParser(), new RuntimePolicyEvaluator(),
                new HitlGate(properties.getMaxHitlRequestsPerRun()), store, eventBus,
                new OrchestratorMetrics(meterRegistry), properties);
    }

    private RunResult run(RunRequest request) {
        return engine().run(request, events::add, "corr-1");
    }

    // -- Helpers -------------------------------------------------------------

    /** Capability whose behaviour is a function of its context; counts invocations. */
    private static final class StubCapability implements Capability {
        private final CapabilityRegistration registration;
        private final Function<CapabilityContext, CapabilityResult> behaviour;
        private final List<CapabilityContext> invocations = new ArrayList<>();

        StubCapability(String id, Set<String> outputs, List<GuardDefinition> guards,
                       Function<CapabilityContext, CapabilityResult> behaviour) {
            this.registration = new CapabilityRegistration(id, id, Set.of(), outputs, List.of(), guards);
            this.behaviour = behaviour;
        }

        @Override
        public CapabilityRegistration registration() {
            return registration;
        }

        @Override
        public CapabilityResult invoke(CapabilityContext context) {
            invocations.add(context);
            return behaviour.apply(context);
        }
    }

    private StubCapability register(String id, Set<String> outputs,
                                    Function<CapabilityContext, CapabilityResult> behaviour) {
        return register(id, outputs, List.of(), behaviour);
    }

    private StubCapability register(String id, Set<String> outputs, List<GuardDefinition> guards,
                                    Function<CapabilityContext, CapabilityResult> behaviour) {
        StubCapability capability = new StubCapability(id, outputs, guards, behaviour);
        registry.register(capability);
        return capability;
    }

    private void plan(PlanStep... steps) {
        plannerScript.add(PlanDelta.adding(steps));
    }

    private List<RunEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    private List<Object> messageKinds() {
        return ofType(EventType.MESSAGE).stream().map(e -> e.payload().get("kind")).toList();
    }

    private RunEvent message(String kind) {
        return ofType(EventType.MESSAGE).stream()
                .filter(e -> kind.equals(e.payload().get("kind")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No message of kind " + kind + " in " + messageKinds()));
    }

    private List<Object> phases() {
        return ofType(EventType.PHASE).stream().map(e -> e.payload().get("phase")).toList();
    }

    private static Map<String, Object> policy(String id, Map<String, Object> trigger, Map<String, Object> action) {
        return Map.of("id", id, "trigger", trigger, "action", action);
    }

    private static HitlPayload choice() {
        return new HitlPayload("Which angle should the launch post take?", HitlKind.CHOICE,
                List.of(new HitlOption("product", "Product focus", null),
                        new HitlOption("story", "Customer story", null)),
                false, HitlUrgency.NORMAL, null);
    }

    // -- Basic runs ----------------------------------------------------------

    @Nested
    @DisplayName("basic runs")
    class BasicRuns {

        @Test
        @DisplayName("a finalize-only plan completes with exactly one complete event")
        void finalizeOnly() {
            plan(PlanStep.finalizeStep("finalize"));

            RunResult result = run(RunRequest.of("Write a launch post"));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals(1, ofType(EventType.COMPLETE).size());
            assertTrue(ofType(EventType.ERROR).isEmpty());
            assertEquals(EventType.START, events.get(0).type());
            assertEquals(EventType.COMPLETE, events.get(events.size() - 1).type());
            assertEquals("completed", events.get(events.size() - 1).payload().get("outcome"));
            assertEquals(List.of("finalization"), phases());
            assertTrue(result.runId().matches("RUN-\\d{4}-\\d{4}"));
        }

        @Test
        @DisplayName("start event carries run id, objective, mode and correlation id")
        void startPayload() {
            plan(PlanStep.finalizeStep("finalize"));

            RunResult result = engine().run("RUN-2026-0042",
                    new RunRequest("Write a launch post", RunMode.CHAT, null, null, null, null, null),
                    events::add, "corr-7");

            Map<String, Object> start = events.get(0).payload();
            assertEquals("RUN-2026-0042", result.runId());
            assertEquals("RUN-2026-0042", start.get("runId"));
            assertEquals("Write a launch post", start.get("objective"));
            assertEquals("chat", start.get("mode"));
            assertEquals("corr-7", start.get("correlationId"));
            assertFalse(start.containsKey("threadId"));
        }

        @Test
        @DisplayName("capabilities run in plan order, then a finalize step is appended")
        void threeStepPlan() {
            register("strategy", Set.of("writerBrief"),
                    ctx -> CapabilityResult.of(Map.of("writerBrief", "angle: launch", "secret", "dropped")));
            StubCapability generation = register("generation", Set.of("drafts"),
                    ctx -> CapabilityResult.of(Map.of("drafts", List.of("Draft for " + ctx.inputs().get("writerBrief")))));
            register("qa", Set.of("qaFindings"), ctx -> CapabilityResult.of(Map.of("qaFindings", Map.of("score", 0.9))));
            plan(PlanStep.capability("s1", "strategy", "Strategy"),
                    PlanStep.capability("g1", "generation", "Drafts"),
                    PlanStep.capability("q1", "qa", "Review"));

            RunResult result = run(RunRequest.of("Write a launch post"));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals(List.of("analysis", "generation", "qa", "finalization"), phases());
            assertEquals(List.of("Draft for angle: launch"), result.facets().get("drafts"));
            assertFalse(result.facets().containsKey("secret"));
            assertEquals("Write a launch post", generation.invocations.get(0).inputs().get("objective"));
            assertEquals(4, result.summary().get("steps"));
            assertEquals(List.of("run_report"), messageKinds());
            assertEquals(1, ofType(EventType.METRICS).size());
        }

        @Test
        @DisplayName("a throwing capability fails the run when no policy handles it")
        void capabilityThrows() {
            register("generation", Set.of("drafts"), ctx -> {
                throw new IllegalStateException("model unavailable");
            });
            plan(PlanStep.capability("g1", "generation", null));

            RunResult result = run(RunRequest.of("Write a launch post"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals("Step g1 failed: model unavailable", result.error());
            RunEvent failed = ofType(EventType.PROGRESS).stream()
                    .filter(e -> "step_failed".equals(e.payload().get("kind"))).findFirst().orElseThrow();
            assertEquals("g1", failed.stepId());
            assertEquals(1, ofType(EventType.COMPLETE).size());
        }

        @Test
        @DisplayName("unhandled failures can be configured to continue")
        void continueOnFailure() {
            properties.setFailOnUnhandledStepFailure(false);
            register("generation", Set.of("drafts"), ctx -> {
                throw new IllegalStateException("model unavailable");
            });
            plan(PlanStep.capability("g1", "generation", null));

            RunResult result = run(RunRequest.of("Write a launch post"));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertNull(result.error());
            assertEquals(1L, result.summary().get("failures"));
        }

        @Test
        @DisplayName("a step for an unregistered capability fails")
        void unknownCapability() {
            plan(PlanStep.capability("x1", "translation", null));

            RunResult result = run(RunRequest.of("Translate"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertTrue(result.error().contains("Unknown capability 'translation'"));
        }

        @Test
        @DisplayName("the loop stops after the iteration budget")
        void iterationBudget() {
            properties.setMaxIterations(2);
            register("generation", Set.of("drafts"), ctx -> CapabilityResult.of(Map.of("drafts", "x")));
            plan(PlanStep.capability("g1", "generation", null),
                    PlanStep.capability("g2", "generation", null),
                    PlanStep.capability("g3", "generation", null));

            RunResult result = run(RunRequest.of("Write three drafts"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals("Run stopped after 2 iterations without finalizing", result.error());
        }

        @Test
        @DisplayName("a failing sink is detached; the bus still sees the terminal event")
        void failingSink() {
            plan(PlanStep.finalizeStep("finalize"));
            List<RunEvent> observed = new ArrayList<>();
            eventBus.subscribeAll(observed::add);

            RunResult result = engine().run(RunRequest.of("Write"), event -> {
                throw new IllegalStateException("client gone");
            }, null);

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals(EventType.COMPLETE, observed.get(observed.size() - 1).type());
        }
    }

    // -- Guards --------------------------------------------------------------

    @Nested
    @DisplayName("guards")
    class Guards {

        @Test
        @DisplayName("a failed guard fails the step and the run")
        void guardFailure() {
            register("qa", Set.of("qaFindings"),
                    List.of(guardEvaluator.define("qaFindings", "/score", "value >= 0.6")),
                    ctx -> CapabilityResult.of(Map.of("qaFindings", Map.of("score", 0.2))));
            plan(PlanStep.capability("q1", "qa", null));

            RunResult result = run(RunRequest.of("Review the draft"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertTrue(result.error().contains("Guard failed: qaFindings/score failed value >= 0.6"));
            RunEvent complete = ofType(EventType.COMPLETE).get(0);
            @SuppressWarnings("unchecked")
            Map<String, Object> report = (Map<String, Object>) complete.payload().get("acceptanceReport");
            assertEquals(false, report.get("passed"));
        }

        @Test
        @DisplayName("passing guards appear in the acceptance report")
        void guardPasses() {
            register("qa", Set.of("qaFindings"),
                    List.of(guardEvaluator.define("qaFindings", "/score", "value >= 0.6")),
                    ctx -> CapabilityResult.of(Map.of("qaFindings", Map.of("score", 0.8))));
            plan(PlanStep.capability("q1", "qa", null));

            run(RunRequest.of("Review the draft"));

            @SuppressWarnings("unchecked")
            Map<String, Object> report = (Map<String, Object>) ofType(EventType.COMPLETE).get(0)
                    .payload().get("acceptanceReport");
            assertEquals(true, report.get("passed"));
            assertEquals(1, ((List<?>) report.get("criteria")).size());
        }
    }

    // -- Policies ------------------------------------------------------------

    @Nested
    @DisplayName("policies")
    class Policies {

        @Test
        @DisplayName("legacy policy actions are rejected before anything is emitted")
        void legacyPolicy() {
            RunRequest request = new RunRequest("Write", RunMode.APP, null, null,
                    List.of(policy("old", Map.of("kind", "onValidationFail"), Map.of("type", "jump", "next", "g1"))),
                    null, null);
            OrchestratorEngine engine = engine();

            var e = assertThrows(LegacyPolicyActionException.class, () -> engine.run(request, events::add, null));

            assertTrue(e.getMessage().contains("use 'goto' instead"));
            assertTrue(events.isEmpty());
            assertEquals(0, plannerCalls.get());
        }

        @Test
        @DisplayName("goto on validation failure re-issues a finished step")
        void gotoReissue() {
            StubCapability generation = register("generation", Set.of("drafts"),
                    ctx -> CapabilityResult.of(Map.of("drafts", "draft")));
            register("qa", Set.of("qaFindings"),
                    List.of(guardEvaluator.define("qaFindings", "/score", "value >= 0.6")),
                    ctx -> CapabilityResult.of(Map.of("qaFindings", Map.of("score", 0.1))));
            plan(PlanStep.capability("gen", "generation", null), PlanStep.capability("qa", "qa", null));

            RunResult result = run(new RunRequest("Write", RunMode.APP, null, null,
                    List.of(policy("qa-retry",
                            Map.of("kind", "onValidationFail", "selector", Map.of("capabilityId", "qa")),
                            Map.of("type", "goto", "next", "gen"))),
                    null, null));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals(2, generation.invocations.size());
            assertEquals("gen__2", generation.invocations.get(1).stepId());
            assertTrue(ofType(EventType.PROGRESS).stream()
                    .anyMatch(e -> "Re-issued gen".equals(e.payload().get("note"))));
        }

        @Test
        @DisplayName("pause stops the run without failing it")
        void pause() {
            register("strategy", Set.of("writerBrief"), ctx -> CapabilityResult.of(Map.of("writerBrief", "b")));
            StubCapability generation = register("generation", Set.of("drafts"),
                    ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("s1", "strategy", null), PlanStep.capability("g1", "generation", null));

            RunResult result = run(new RunRequest("Write", RunMode.APP, "thread-pause", null,
                    List.of(policy("hold", Map.of("kind", "onNodeComplete", "selector", Map.of("nodeId", "s1")),
                            Map.of("type", "pause", "reason", "Brief review"))),
                    null, null));

            assertEquals(RunOutcome.PAUSED, result.outcome());
            assertEquals("Brief review", message("paused").payload().get("reason"));
            assertTrue(generation.invocations.isEmpty());
            assertEquals(StepStatus.PENDING, store.get("thread-pause").orElseThrow().plan().find("g1").orElseThrow().status());
        }

        @Test
        @DisplayName("fail on start ends the run before planning")
        void failOnStart() {
            RunResult result = run(new RunRequest("Write", RunMode.APP, null, null,
                    List.of(policy("closed", Map.of("kind", "onStart"), Map.of("type", "fail", "message", "Maintenance"))),
                    null, null));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals("Maintenance", result.error());
            assertEquals(0, plannerCalls.get());
        }

        @Test
        @DisplayName("emit surfaces a message and the run carries on")
        void emit() {
            register("generation", Set.of("drafts"), ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("g1", "generation", null));

            RunResult result = run(new RunRequest("Write", RunMode.APP, null, null,
                    List.of(policy("notify", Map.of("kind", "onNodeComplete"),
                            Map.of("type", "emit", "event", "draft_ready", "payload", Map.of("channel", "ops")))),
                    null, null));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            RunEvent emitted = message("policy_emit");
            assertEquals("draft_ready", emitted.payload().get("event"));
            assertEquals("g1", emitted.stepId());
        }

        @Test
        @DisplayName("default policies apply when the request carries none")
        void defaultPolicies() {
            properties.setDefaultPolicies(List.of(
                    policy("closed", Map.of("kind", "onStart"), Map.of("type", "fail"))));

            RunResult result = run(RunRequest.of("Write"));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals("Run failed by policy closed", result.error());
        }

        @Test
        @DisplayName("replan passes the rationale to the next planner call")
        void replan() {
            List<String> rationales = new ArrayList<>();
            Planner recording = context -> {
                rationales.add(context.replanRationale());
                return plannerScript.isEmpty() ? PlanDelta.empty() : plannerScript.poll();
            };
            register("qa", Set.of("qaFindings"), ctx -> CapabilityResult.of(Map.of("qaFindings", "ok")));
            plan(PlanStep.capability("q1", "qa", null));
            OrchestratorEngine engine = new OrchestratorEngine(recording, new PlanStateMachine(), registry,
                    guardEvaluator, new RuntimePolicyParser(), new RuntimePolicyEvaluator(), new HitlGate(3), store,
                    eventBus, new OrchestratorMetrics(meterRegistry), properties);

            engine.run(new RunRequest("Review", RunMode.APP, null, null,
                    List.of(policy("rethink", Map.of("kind", "onNodeComplete"),
                            Map.of("type", "replan", "rationale", "Scores look odd"))),
                    null, null), events::add, null);

            assertNull(rationales.get(0));
            assertEquals("Scores look odd", rationales.get(1));
        }

        @Test
        @DisplayName("malformed default policies are rejected when the engine is built")
        void malformedDefaultPolicies() {
            properties.setDefaultPolicies(List.of(
                    policy("p", Map.of("kind", "onStart"), Map.of("type", "abort"))));

            var e = assertThrows(LegacyPolicyActionException.class, OrchestratorEngineTest.this::engine);

            assertEquals("Policy 'p': Unsupported legacy action 'abort'; use 'fail' instead", e.getMessage());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("a hitl action pauses after a step that did not ask for input")
        void hitlActionPauses() {
            register("generation", Set.of("drafts"), ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("g1", "generation", null));

            RunResult result = run(new RunRequest("Write", RunMode.APP, "thread-approve", null,
                    List.of(approvalPolicy()), null, null));

            assertEquals(RunOutcome.PENDING_HITL, result.outcome());
            RunEvent request = message("hitl_request");
            assertEquals("g1", request.stepId());
            assertEquals(result.pendingRequestId(), request.payload().get("requestId"));
            RunSnapshot snapshot = store.get("thread-approve").orElseThrow();
            assertEquals(StepStatus.COMPLETED, snapshot.plan().find("g1").orElseThrow().status());
            assertEquals(result.pendingRequestId(), snapshot.awaitingRequestId());
        }

        @Test
        @DisplayName("approving a policy request resumes without re-running the completed step")
        void hitlActionApproved() {
            StubCapability generation = register("generation", Set.of("drafts"),
                    ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("g1", "generation", null));
            RunResult first = run(new RunRequest("Write", RunMode.APP, "thread-approve", null,
                    List.of(approvalPolicy()), null, null));
            events.clear();

            RunResult second = run(new RunRequest(null, null, "thread-approve", null, null,
                    List.of(HitlResponse.approve(first.pendingRequestId())), null));

            assertEquals(RunOutcome.COMPLETED, second.outcome());
            assertEquals(1, generation.invocations.size());
            assertEquals(StepStatus.COMPLETED,
                    store.get("thread-approve").orElseThrow().plan().find("g1").orElseThrow().status());
        }

        @Test
        @DisplayName("denying a policy request raises onValidationFail for the step")
        void hitlActionDenied() {
            register("generation", Set.of("drafts"), ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("g1", "generation", null));
            List<Map<String, Object>> policies = List.of(approvalPolicy(),
                    policy("on-denial",
                            Map.of("kind", "onValidationFail", "selector", Map.of("capabilityId", "generation")),
                            Map.of("type", "emit", "event", "approval_denied")));
            RunResult first = run(new RunRequest("Write", RunMode.APP, "thread-approve", null,
                    policies, null, null));
            events.clear();

            RunResult second = run(new RunRequest(null, null, "thread-approve", null, null,
                    List.of(HitlResponse.reject(first.pendingRequestId(), "Not on brand")), null));

            assertEquals(RunOutcome.COMPLETED, second.outcome());
            assertEquals("Not on brand", message("hitl_denied").payload().get("reason"));
            RunEvent emitted = message("policy_emit");
            assertEquals("approval_denied", emitted.payload().get("event"));
            assertEquals("g1", emitted.stepId());
            assertEquals(StepStatus.COMPLETED,
                    store.get("thread-approve").orElseThrow().plan().find("g1").orElseThrow().status());
        }

        @Test
        @DisplayName("onTimeout matches a step that ran at least the configured time")
        void timeoutTrigger() {
            register("generation", Set.of("drafts"), ctx -> {
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CapabilityResult.of(Map.of("drafts", "d"));
            });
            plan(PlanStep.capability("g1", "generation", null));

            RunResult result = run(new RunRequest("Write", RunMode.APP, null, null,
                    List.of(policy("slow",
                            Map.of("kind", "onTimeout", "ms", 10, "selector", Map.of("capabilityId", "generation")),
                            Map.of("type", "fail", "message", "Generation too slow"))),
                    null, null));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals("Generation too slow", result.error());
        }

        @Test
        @DisplayName("onMetricBelow matches only when the reported metric is under the threshold")
        void metricBelowTrigger() {
            List<Map<String, Object>> policies = List.of(policy("low-readability",
                    Map.of("kind", "onMetricBelow", "metric", "readability", "threshold", 0.5),
                    Map.of("type", "pause", "reason", "Readability too low")));
            register("qa", Set.of("qaFindings"),
                    ctx -> new CapabilityResult(Map.of("qaFindings", "ok"), null, Map.of("readability", 0.3)));
            plan(PlanStep.capability("q1", "qa", null));

            RunResult low = run(new RunRequest("Review", RunMode.APP, null, null, policies, null, null));

            assertEquals(RunOutcome.PAUSED, low.outcome());
            assertEquals("Readability too low", message("paused").payload().get("reason"));
        }

        @Test
        @DisplayName("onMetricBelow leaves the run alone at or above the threshold")
        void metricAboveThreshold() {
            register("qa", Set.of("qaFindings"),
                    ctx -> new CapabilityResult(Map.of("qaFindings", "ok"), null, Map.of("readability", 0.5)));
            plan(PlanStep.capability("q1", "qa", null));

            RunResult result = run(new RunRequest("Review", RunMode.APP, null, null,
                    List.of(policy("low-readability",
                            Map.of("kind", "onMetricBelow", "metric", "readability", "threshold", 0.5),
                            Map.of("type", "pause", "reason", "Readability too low"))),
                    null, null));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
        }

        private Map<String, Object> approvalPolicy() {
            return policy("sign-off",
                    Map.of("kind", "onNodeComplete", "selector", Map.of("capabilityId", "generation")),
                    Map.of("type", "hitl", "rationale", "Approve the drafts?"));
        }
    }

    // -- Human in the loop ---------------------------------------------------

    @Nested
    @DisplayName("human in the loop")
    class HumanInTheLoop {

        private StubCapability strategy;

        @BeforeEach
        void registerCapabilities() {
            strategy = register("strategy", Set.of("writerBrief"), ctx -> ctx.hitlResponses().isEmpty()
                    ? CapabilityResult.askHuman(choice())
                    : CapabilityResult.of(Map.of("writerBrief", "angle: " + ctx.hitlResponses().get(0).selectedOptionId())));
            register("generation", Set.of("drafts"), ctx -> CapabilityResult.of(Map.of("drafts", "d")));
            plan(PlanStep.capability("s1", "strategy", null), PlanStep.capability("g1", "generation", null));
        }

        @Test
        @DisplayName("a choice request pauses the run with a pending request id")
        void pausesOnChoice() {
            RunResult result = run(RunRequest.onThread("Write a launch post", "thread-1"));

            assertEquals(RunOutcome.PENDING_HITL, result.outcome());
            assertNotNull(result.pendingRequestId());
            assertFalse(result.pendingRequestId().isBlank());
            RunEvent request = message("hitl_request");
            assertEquals(result.pendingRequestId(), request.payload().get("requestId"));
            assertEquals("s1", request.stepId());
            assertEquals(result.pendingRequestId(),
                    ofType(EventType.COMPLETE).get(0).payload().get("pendingRequestId"));

            RunSnapshot snapshot = store.get("thread-1").orElseThrow();
            assertEquals(StepStatus.AWAITING_HITL, snapshot.plan().find("s1").orElseThrow().status());
            assertEquals(result.pendingRequestId(), snapshot.awaitingRequestId());
        }

        @Test
        @DisplayName("resuming with an answer re-runs the waiting step and completes")
        void resumeWithAnswer() {
            RunResult first = run(RunRequest.onThread("Write a launch post", "thread-1"));
            int storedVersion = store.get("thread-1").orElseThrow().plan().version();
            events.clear();

            RunResult second = run(new RunRequest(null, null, "thread-1", null, null,
                    List.of(HitlResponse.option(first.pendingRequestId(), "story")), null));

            assertEquals(RunOutcome.COMPLETED, second.outcome());
            RunEvent resume = message("resume");
            assertEquals(storedVersion, resume.payload().get("planVersion"));
            assertEquals("thread-1", resume.payload().get("threadId"));
            assertEquals("Write a launch post", events.get(0).payload().get("objective"));
            assertEquals(2, strategy.invocations.size());
            assertEquals(1, strategy.invocations.get(1).hitlResponses().size());
            assertEquals("angle: story", second.facets().get("writerBrief"));
            assertNotEquals(first.runId(), second.runId());
        }

        @Test
        @DisplayName("resuming without an answer stays pending")
        void resumeWithoutAnswer() {
            RunResult first = run(RunRequest.onThread("Write a launch post", "thread-1"));
            events.clear();

            RunResult second = run(RunRequest.onThread(null, "thread-1"));

            assertEquals(RunOutcome.PENDING_HITL, second.outcome());
            assertEquals(first.pendingRequestId(), second.pendingRequestId());
            assertEquals(first.pendingRequestId(), message("hitl_pending").payload().get("requestId"));
            assertEquals(1, strategy.invocations.size());
        }

        @Test
        @DisplayName("a rejection fails the waiting step and reports the denial")
        void rejection() {
            RunResult first = run(RunRequest.onThread("Write a launch post", "thread-1"));
            events.clear();

            RunResult second = run(new RunRequest(null, null, "thread-1", null, null,
                    List.of(HitlResponse.reject(first.pendingRequestId(), "Neither angle works")), null));

            assertEquals("Neither angle works", message("hitl_denied").payload().get("reason"));
            assertEquals(StepStatus.FAILED,
                    store.get("thread-1").orElseThrow().plan().find("s1").orElseThrow().status());
            assertEquals(RunOutcome.COMPLETED, second.outcome());
            assertEquals(1, strategy.invocations.size());
        }

        @Test
        @DisplayName("a response asking to fail ends the run as failed")
        void failDecision() {
            RunResult first = run(RunRequest.onThread("Write a launch post", "thread-1"));

            RunResult second = run(new RunRequest(null, null, "thread-1", null, null,
                    List.of(new HitlResponse(null, first.pendingRequestId(), null, null, "Stop", false, "ops",
                            null, Map.of("action", "fail"), null)), null));

            assertEquals(RunOutcome.FAILED, second.outcome());
            assertTrue(second.error().contains(first.pendingRequestId()));
        }

        @Test
        @DisplayName("a response for an unknown request is logged and ignored")
        void unknownResponse() {
            run(RunRequest.onThread("Write a launch post", "thread-1"));
            events.clear();

            RunResult second = run(new RunRequest(null, null, "thread-1", null, null,
                    List.of(HitlResponse.approve("not-a-request")), null));

            assertEquals(RunOutcome.PENDING_HITL, second.outcome());
            assertTrue(ofType(EventType.LOG).stream()
                    .anyMatch(e -> "Unknown HITL request: not-a-request".equals(e.payload().get("message"))));
        }

        @Test
        @DisplayName("requests over the limit are denied and the run carries on")
        void overLimit() {
            properties.setMaxHitlRequestsPerRun(0);

            RunResult result = run(RunRequest.onThread("Write a launch post", "thread-1"));

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertTrue(ofType(EventType.LOG).stream().anyMatch(e ->
                    ((String) e.payload().get("message")).contains(HitlGate.LIMIT_REASON)));
            assertEquals(1, result.summary().get("hitlDenied"));
        }
    }

    @Test
    @DisplayName("phase names follow the capability")
    void phaseNames() {
        assertEquals("analysis", OrchestratorEngine.phaseFor("strategy"));
        assertEquals("generation", OrchestratorEngine.phaseFor("generation"));
        assertEquals("qa", OrchestratorEngine.phaseFor("qa"));
        assertEquals("execution", OrchestratorEngine.phaseFor("translation"));
    }
}
