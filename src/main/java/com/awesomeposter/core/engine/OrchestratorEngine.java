package com.awesomeposter.core.engine;

import com.awesomeposter.core.capability.Capability;
import com.awesomeposter.core.capability.CapabilityContext;
import com.awesomeposter.core.capability.CapabilityRegistration;
import com.awesomeposter.core.capability.CapabilityRegistry;
import com.awesomeposter.core.capability.CapabilityResult;
import com.awesomeposter.core.events.EventBus;
import com.awesomeposter.core.events.EventType;
import com.awesomeposter.core.events.RunEventSink;
import com.awesomeposter.core.guard.GuardEvaluator;
import com.awesomeposter.core.guard.GuardResult;
import com.awesomeposter.core.hitl.HitlDecision;
import com.awesomeposter.core.hitl.HitlGate;
import com.awesomeposter.core.hitl.HitlPayload;
import com.awesomeposter.core.hitl.HitlRequest;
import com.awesomeposter.core.hitl.HitlRequestConflictException;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.hitl.HitlStatus;
import com.awesomeposter.core.hitl.UnknownHitlRequestException;
import com.awesomeposter.core.logging.MdcContext;
import com.awesomeposter.core.metrics.OrchestratorMetrics;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepResult;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.persistence.ResumeStore;
import com.awesomeposter.core.persistence.RunSnapshot;
import com.awesomeposter.core.plan.PlanStateMachine;
import com.awesomeposter.core.planner.Planner;
import com.awesomeposter.core.planner.PlannerContext;
import com.awesomeposter.core.policy.LifecycleEvent;
import com.awesomeposter.core.policy.PolicyAction;
import com.awesomeposter.core.policy.RuntimePolicy;
import com.awesomeposter.core.policy.RuntimePolicyEvaluator;
import com.awesomeposter.core.policy.RuntimePolicyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.awesomeposter.core.engine.RunEmitter.payload;

/**
 * Drives a run: asks the planner for plan deltas, executes capability steps one at a time,
 * checks guards, reacts to step transitions with runtime policies and pauses for humans.
 * <p>
 * A run with a thread id continues from the snapshot stored under that id and writes a new
 * snapshot after every finished step. Every run emits exactly one terminal event:
 * {@code complete} carrying the outcome, or {@code error} for unexpected failures.
 */
@Service
public class OrchestratorEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final Planner planner;
    private final PlanStateMachine stateMachine;
    private final CapabilityRegistry capabilities;
    private final GuardEvaluator guardEvaluator;
    private final RuntimePolicyParser policyParser;
    private final RuntimePolicyEvaluator policyEvaluator;
    private final HitlGate hitlGate;
    private final ResumeStore resumeStore;
    private final EventBus eventBus;
    private final OrchestratorMetrics metrics;
    private final OrchestratorProperties properties;
    private final List<RuntimePolicy> defaultPolicies;

    /**
     * @throws com.awesomeposter.core.policy.PolicyConfigurationException if the configured
     *         default policies are malformed, so a bad configuration stops the application
     */
    public OrchestratorEngine(Planner planner, PlanStateMachine stateMachine, CapabilityRegistry capabilities,
                              GuardEvaluator guardEvaluator, RuntimePolicyParser policyParser,
                              RuntimePolicyEvaluator policyEvaluator, HitlGate hitlGate, ResumeStore resumeStore,
                              EventBus eventBus, OrchestratorMetrics metrics, OrchestratorProperties properties) {
        this.planner = planner;
        this.stateMachine = stateMachine;
        this.capabilities = capabilities;
        this.guardEvaluator = guardEvaluator;
        this.policyParser = policyParser;
        this.policyEvaluator = policyEvaluator;
        this.hitlGate = hitlGate;
        this.resumeStore = resumeStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.defaultPolicies = policyParser.parse(properties.getDefaultPolicies());
        if (!defaultPolicies.isEmpty()) {
            log.info("Loaded {} default runtime policies", defaultPolicies.size());
        }
    }

    public String generateRunId() {
        return String.format("RUN-%d-%04d", Year.now().getValue(), RUN_COUNTER.incrementAndGet());
    }

    public RunResult run(RunRequest request, RunEventSink sink, String correlationId) {
        return run(generateRunId(), request, sink, correlationId);
    }

    /**
     * Runs or resumes a request under a pre-generated run id (e.g. from the REST controller).
     *
     * @throws com.awesomeposter.core.policy.PolicyConfigurationException if the request's policies
     *         are malformed; nothing is emitted in that case
     */
    public RunResult run(String runId, RunRequest request, RunEventSink sink, String correlationId) {
        List<RuntimePolicy> requestPolicies = request.policies().isEmpty() ? null : policyParser.parse(request.policies());

        MdcContext.setRun(runId, request.threadId(), correlationId);
        RunEmitter events = new RunEmitter(runId, sink, eventBus);
        RunState state = null;
        try {
            log.info("Starting run {} ({}) thread={}: {}", runId, request.mode().wireName(),
                    request.threadId(), request.objective());
            state = open(runId, request, requestPolicies);

            events.emit(EventType.START, null, payload(
                    "runId", runId,
                    "threadId", state.threadId,
                    "objective", state.objective,
                    "mode", state.mode.wireName(),
                    "correlationId", correlationId,
                    "planVersion", state.plan.version()));
            if (state.resumed) {
                log.info("Resuming thread {} at plan v{}", state.threadId, state.plan.version());
                events.emit(EventType.MESSAGE, null, payload(
                        "kind", "resume",
                        "message", "Resuming existing thread state",
                        "threadId", state.threadId,
                        "planVersion", state.plan.version()));
            }

            RunOutcome outcome = drive(state, request, events);
            return finish(state, outcome, events);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Run {} failed with an unexpected error", runId, e);
            if (!events.terminated()) {
                events.emit(EventType.ERROR, null, payload("runId", runId, "message", message));
            }
            metrics.recordRunResult(RunOutcome.ERROR.wireName());
            return new RunResult(runId, request.threadId(), RunOutcome.ERROR,
                    state != null ? state.plan.version() : 0,
                    state != null ? new LinkedHashMap<>(state.facets) : Map.of(),
                    null, message, state != null ? state.summary() : Map.of());
        } finally {
            MdcContext.clear();
        }
    }

    // --- Setup ---

    private RunState open(String runId, RunRequest request, List<RuntimePolicy> requestPolicies) {
        Optional<RunSnapshot> snapshot = request.hasThread() ? resumeStore.get(request.threadId()) : Optional.empty();
        RunState state = snapshot
                .map(s -> RunState.resume(runId, request, s))
                .orElseGet(() -> RunState.fresh(runId, request));

        if (requestPolicies != null) {
            state.rawPolicies = request.policies();
            state.policies = requestPolicies;
        } else if (snapshot.isPresent() && !snapshot.get().policies().isEmpty()) {
            state.rawPolicies = snapshot.get().policies();
            state.policies = policyParser.parse(state.rawPolicies);
        } else {
            state.rawPolicies = properties.getDefaultPolicies();
            state.policies = defaultPolicies;
        }
        return state;
    }

    // --- Loop ---

    private RunOutcome drive(RunState state, RunRequest request, RunEmitter events) {
        applyResponses(state, request.hitlResponses(), events);
        if (state.hitl.pendingRequestId() != null) {
            events.emit(EventType.MESSAGE, null, payload(
                    "kind", "hitl_pending",
                    "message", "Waiting for a response to the pending HITL request",
                    "requestId", state.hitl.pendingRequestId()));
            return RunOutcome.PENDING_HITL;
        }

        Optional<RunOutcome> reconciled = reconcileAwaiting(state, events);
        if (reconciled.isPresent()) {
            return reconciled.get();
        }

        if (!state.resumed) {
            Optional<RunOutcome> onStart = react(state, LifecycleEvent.runStarted(), events, false);
            if (onStart.isPresent()) {
                return onStart.get();
            }
        }
        if (request.manualTrigger() != null) {
            String node = request.manualTrigger().isBlank() ? null : request.manualTrigger();
            Optional<RunOutcome> manual = react(state, LifecycleEvent.manual(node), events, false);
            if (manual.isPresent()) {
                return manual.get();
            }
        }

        for (int iteration = 0; iteration < properties.getMaxIterations(); iteration++) {
            PlanDelta delta = planner.propose(new PlannerContext(state.runId, state.objective, state.mode,
                    state.plan, Collections.unmodifiableMap(new LinkedHashMap<>(state.facets)), List.copyOf(state.history),
                    state.replanRationale, capabilities.registrations()));
            state.replanRationale = null;
            if (!delta.isEmpty()) {
                state.plan = stateMachine.apply(state.plan, delta);
                emitPlan(state, delta.note(), events);
            }

            Optional<PlanStep> next = stateMachine.nextRunnable(state.plan, state.preferredNext);
            state.preferredNext = null;
            if (next.isEmpty()) {
                if (state.plan.isFinalized()) {
                    return RunOutcome.COMPLETED;
                }
                state.plan = stateMachine.ensureFinalize(state.plan);
                emitPlan(state, "Finalize step added", events);
                next = stateMachine.nextRunnable(state.plan, null);
            }
            PlanStep step = next.orElseThrow();

            if (step.isFinalize()) {
                state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.RUNNING);
                state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.COMPLETED);
                events.emit(EventType.PHASE, step.id(), payload("phase", "finalization", "stepId", step.id()));
                state.history.add(new StepResult(step.id(), step.target(), StepStatus.COMPLETED, Map.of(), null, 0,
                        state.nextAttempt(step.target())));
                return RunOutcome.COMPLETED;
            }
            Optional<RunOutcome> outcome = execute(state, step, events);
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
        state.error = "Run stopped after " + properties.getMaxIterations() + " iterations without finalizing";
        log.warn(state.error);
        return RunOutcome.FAILED;
    }

    private Optional<RunOutcome> execute(RunState state, PlanStep step, RunEmitter events) {
        String capabilityId = step.capabilityId();
        MdcContext.setStep(step.id(), capabilityId);
        try {
            state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.RUNNING);
            events.emit(EventType.PHASE, step.id(), payload(
                    "phase", phaseFor(capabilityId),
                    "stepId", step.id(),
                    "capabilityId", capabilityId,
                    "label", step.label()));

            Optional<Capability> capability = capabilities.find(capabilityId);
            int attempt = state.nextAttempt(capabilityId);
            if (capability.isEmpty()) {
                return failStep(state, step, "Unknown capability '" + capabilityId + "'", 0, attempt,
                        LifecycleEvent.Stage.NODE_FAILED, Map.of(), events);
            }
            CapabilityRegistration registration = capability.get().registration();

            long started = System.currentTimeMillis();
            CapabilityResult result;
            try {
                result = capability.get().invoke(new CapabilityContext(state.runId, step.id(), state.objective,
                        state.mode, select(state.facets, registration.inputFacets()),
                        state.hitl.responsesForStep(step.id()), step.note()));
            } catch (RuntimeException e) {
                long elapsed = System.currentTimeMillis() - started;
                metrics.recordStepDuration(capabilityId, elapsed);
                log.warn("Capability {} failed on step {}: {}", capabilityId, step.id(), e.getMessage());
                return failStep(state, step, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                        elapsed, attempt, LifecycleEvent.Stage.NODE_FAILED, Map.of(), events);
            }
            long elapsed = System.currentTimeMillis() - started;
            metrics.recordStepDuration(capabilityId, elapsed);

            Map<String, Object> outputs = select(result.outputs(), registration.outputFacets());
            if (outputs.size() < result.outputs().size()) {
                log.warn("Dropped undeclared outputs from {}: {}", capabilityId,
                        result.outputs().keySet().stream().filter(k -> !outputs.containsKey(k)).toList());
            }
            state.facets.putAll(outputs);

            if (result.hitlRequest() != null) {
                Optional<RunOutcome> paused = askHuman(state, step, result.hitlRequest(), outputs, elapsed, attempt, events);
                if (paused.isPresent()) {
                    return paused;
                }
            }

            List<GuardResult> guards = guardEvaluator.evaluateGuards(registration.guards(), state.facets);
            List<String> failures = new ArrayList<>();
            for (GuardResult guard : guards) {
                state.record(guard);
                metrics.recordGuardResult(guard.passed());
                if (!guard.passed()) {
                    failures.add(guard.error() != null
                            ? guard.facet() + guard.path() + ": " + guard.error()
                            : guard.facet() + guard.path() + " failed " + guard.expression());
                }
            }
            if (!failures.isEmpty()) {
                return failStep(state, step, "Guard failed: " + String.join("; ", failures), elapsed, attempt,
                        LifecycleEvent.Stage.VALIDATION_FAILED, result.metrics(), events, outputs, guards);
            }

            state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.COMPLETED, null, outputs);
            state.history.add(new StepResult(step.id(), capabilityId, StepStatus.COMPLETED, outputs, null, elapsed, attempt));
            events.emit(EventType.PROGRESS, step.id(), payload(
                    "kind", "step_complete",
                    "stepId", step.id(),
                    "capabilityId", capabilityId,
                    "status", StepStatus.COMPLETED.wireName(),
                    "durationMs", elapsed,
                    "outputs", outputs.keySet(),
                    "guards", guards,
                    "metrics", result.metrics().isEmpty() ? null : result.metrics()));
            save(state);

            LifecycleEvent completed = new LifecycleEvent(LifecycleEvent.Stage.NODE_COMPLETED, step.id(),
                    capabilityId, elapsed, result.metrics());
            return react(state, completed, events, false);
        } finally {
            MdcContext.clearStep();
        }
    }

    private Optional<RunOutcome> askHuman(RunState state, PlanStep step, HitlPayload question,
                                          Map<String, Object> outputs, long elapsed, int attempt, RunEmitter events) {
        HitlGate.Raised raised = hitlGate.raise(state.hitl, state.runId, step.id(), step.capabilityId(), question);
        state.hitl = raised.state();
        metrics.recordHitlRequest(raised.accepted());
        HitlRequest request = raised.request();
        if (!raised.accepted()) {
            events.emit(EventType.LOG, step.id(), payload(
                    "level", "warn",
                    "message", "HITL request denied: " + request.denialReason(),
                    "requestId", request.id()));
            return Optional.empty();
        }
        state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.AWAITING_HITL, null, outputs);
        state.awaitingRequestId = request.id();
        state.history.add(new StepResult(step.id(), step.capabilityId(), StepStatus.AWAITING_HITL, outputs, null,
                elapsed, attempt));
        events.emit(EventType.MESSAGE, step.id(), payload(
                "kind", "hitl_request",
                "requestId", request.id(),
                "request", request));
        save(state);
        return Optional.of(RunOutcome.PENDING_HITL);
    }

    private Optional<RunOutcome> failStep(RunState state, PlanStep step, String reason, long elapsed, int attempt,
                                          LifecycleEvent.Stage stage, Map<String, Double> stepMetrics,
                                          RunEmitter events) {
        return failStep(state, step, reason, elapsed, attempt, stage, stepMetrics, events, Map.of(), List.of());
    }

    private Optional<RunOutcome> failStep(RunState state, PlanStep step, String reason, long elapsed, int attempt,
                                          LifecycleEvent.Stage stage, Map<String, Double> stepMetrics,
                                          RunEmitter events, Map<String, Object> outputs, List<GuardResult> guards) {
        state.plan = stateMachine.transition(state.plan, step.id(), StepStatus.FAILED, reason, outputs);
        state.history.add(new StepResult(step.id(), step.capabilityId(), StepStatus.FAILED, outputs, reason,
                elapsed, attempt));
        events.emit(EventType.PROGRESS, step.id(), payload(
                "kind", "step_failed",
                "stepId", step.id(),
                "capabilityId", step.capabilityId(),
                "status", StepStatus.FAILED.wireName(),
                "durationMs", elapsed,
                "error", reason,
                "guards", guards.isEmpty() ? null : guards));
        save(state);
        state.error = "Step " + step.id() + " failed: " + reason;
        return react(state, new LifecycleEvent(stage, step.id(), step.capabilityId(), elapsed, stepMetrics),
                events, properties.isFailOnUnhandledStepFailure());
    }

    // --- HITL resume ---

    private void applyResponses(RunState state, List<HitlResponse> responses, RunEmitter events) {
        for (HitlResponse response : responses) {
            try {
                state.hitl = hitlGate.resolve(state.hitl, response);
                if (response.isDenial()) {
                    metrics.recordHitlDenial();
                }
            } catch (UnknownHitlRequestException | HitlRequestConflictException e) {
                log.warn("Ignoring HITL response for {}: {}", response.requestId(), e.getMessage());
                events.emit(EventType.LOG, null, payload(
                        "level", "warn",
                        "message", e.getMessage(),
                        "requestId", response.requestId()));
            }
        }
    }

    /**
     * Applies the answer to the request the previous run stopped on: a resolved request
     * returns the waiting step to pending, a denied one fails it.
     */
    private Optional<RunOutcome> reconcileAwaiting(RunState state, RunEmitter events) {
        if (state.awaitingRequestId == null) {
            return Optional.empty();
        }
        Optional<HitlRequest> found = state.hitl.find(state.awaitingRequestId);
        state.awaitingRequestId = null;
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HitlRequest request = found.get();
        List<HitlResponse> answers = state.hitl.responsesFor(request.id());
        Optional<HitlResponse> answer = answers.isEmpty() ? Optional.empty() : Optional.of(answers.get(answers.size() - 1));
        Optional<HitlDecision> decision = answer.flatMap(HitlResponse::decision);
        Optional<PlanStep> step = request.stepId() != null ? state.plan.find(request.stepId()) : Optional.empty();
        boolean stepWaiting = step.isPresent() && step.get().status() == StepStatus.AWAITING_HITL;

        if (request.status() == HitlStatus.RESOLVED) {
            if (stepWaiting) {
                state.plan = stateMachine.transition(state.plan, request.stepId(), StepStatus.PENDING);
                state.preferredNext = request.stepId();
            }
            return applyDecision(state, decision, answer, request, events);
        }

        String reason = request.denialReason() != null ? request.denialReason() : "denied";
        if (stepWaiting) {
            state.plan = stateMachine.transition(state.plan, request.stepId(), StepStatus.FAILED,
                    "HITL denied: " + reason, null);
        }
        events.emit(EventType.MESSAGE, request.stepId(), payload(
                "kind", "hitl_denied",
                "requestId", request.id(),
                "reason", reason));
        state.error = "HITL request " + request.id() + " denied: " + reason;
        if (decision.isPresent()) {
            return applyDecision(state, decision, answer, request, events);
        }
        String capabilityId = step.map(PlanStep::capabilityId).orElse(null);
        return react(state, new LifecycleEvent(LifecycleEvent.Stage.VALIDATION_FAILED, request.stepId(),
                capabilityId, null, Map.of()), events, false);
    }

    private Optional<RunOutcome> applyDecision(RunState state, Optional<HitlDecision> decision,
                                               Optional<HitlResponse> answer, HitlRequest request,
                                               RunEmitter events) {
        if (decision.isEmpty()) {
            return Optional.empty();
        }
        return switch (decision.get()) {
            case FAIL -> {
                state.error = "Run failed by HITL response to " + request.id();
                yield Optional.of(RunOutcome.FAILED);
            }
            case EMIT -> {
                events.emit(EventType.MESSAGE, request.stepId(), payload(
                        "kind", "hitl_response",
                        "requestId", request.id(),
                        "response", answer.orElse(null)));
                yield Optional.empty();
            }
            case RESUME -> Optional.empty();
        };
    }

    // --- Policies ---

    /**
     * Applies the first matching policy's action.
     *
     * @param failWhenUnhandled end the run as failed when no policy matches a failure event
     * @return a terminal outcome when the action ends the run
     */
    private Optional<RunOutcome> react(RunState state, LifecycleEvent event, RunEmitter events,
                                       boolean failWhenUnhandled) {
        Optional<RuntimePolicy> match = policyEvaluator.evaluate(state.policies, event);
        if (match.isPresent()) {
            return apply(state, match.get(), event, events);
        }
        if (event.isFailure() && failWhenUnhandled) {
            return Optional.of(RunOutcome.FAILED);
        }
        return Optional.empty();
    }

    private Optional<RunOutcome> apply(RunState state, RuntimePolicy policy, LifecycleEvent event, RunEmitter events) {
        PolicyAction action = policy.action();
        metrics.recordPolicyAction(action.type().wireName());
        return switch (action.type()) {
            case GOTO -> {
                jump(state, ((PolicyAction.Goto) action).next(), events);
                yield Optional.empty();
            }
            case REPLAN -> {
                String rationale = ((PolicyAction.Replan) action).rationale();
                state.replanRationale = rationale != null ? rationale : "Requested by policy " + policy.id();
                yield Optional.empty();
            }
            case HITL -> {
                String rationale = ((PolicyAction.Hitl) action).rationale();
                String question = rationale != null ? rationale
                        : "Approve continuing" + (event.nodeId() != null ? " after step " + event.nodeId() : "") + "?";
                yield approval(state, event, HitlPayload.approval(question), events);
            }
            case FAIL -> {
                state.error = ((PolicyAction.Fail) action).message();
                yield Optional.of(RunOutcome.FAILED);
            }
            case PAUSE -> {
                String reason = ((PolicyAction.Pause) action).reason();
                events.emit(EventType.MESSAGE, event.nodeId(), payload(
                        "kind", "paused",
                        "policyId", policy.id(),
                        "reason", reason));
                yield Optional.of(RunOutcome.PAUSED);
            }
            case EMIT -> {
                PolicyAction.Emit emit = (PolicyAction.Emit) action;
                events.emit(EventType.MESSAGE, event.nodeId(), payload(
                        "kind", "policy_emit",
                        "policyId", policy.id(),
                        "event", emit.event(),
                        "payload", emit.payload()));
                yield Optional.empty();
            }
        };
    }

    private void jump(RunState state, String target, RunEmitter events) {
        Optional<PlanStep> step = state.plan.find(target);
        if (step.isEmpty()) {
            log.warn("goto target '{}' is not in plan v{}", target, state.plan.version());
            events.emit(EventType.LOG, null, payload("level", "warn", "message", "goto target '" + target + "' not found"));
            return;
        }
        StepStatus status = step.get().status();
        if (status == StepStatus.PENDING) {
            state.preferredNext = target;
        } else if (status == StepStatus.COMPLETED || status == StepStatus.FAILED) {
            state.plan = stateMachine.reissue(state.plan, target);
            state.preferredNext = state.plan.steps().get(state.plan.steps().size() - 1).id();
            emitPlan(state, "Re-issued " + target, events);
        } else {
            log.warn("goto target '{}' is {}, ignoring", target, status.wireName());
        }
    }

    /** Raises a policy-driven approval bound to the step that just finished; the step keeps its status. */
    private Optional<RunOutcome> approval(RunState state, LifecycleEvent event, HitlPayload question, RunEmitter events) {
        HitlGate.Raised raised = hitlGate.raise(state.hitl, state.runId, event.nodeId(), event.capabilityId(), question);
        state.hitl = raised.state();
        metrics.recordHitlRequest(raised.accepted());
        if (!raised.accepted()) {
            events.emit(EventType.LOG, event.nodeId(), payload(
                    "level", "warn",
                    "message", "HITL request denied: " + raised.request().denialReason(),
                    "requestId", raised.request().id()));
            return Optional.empty();
        }
        state.awaitingRequestId = raised.request().id();
        events.emit(EventType.MESSAGE, event.nodeId(), payload(
                "kind", "hitl_request",
                "requestId", raised.request().id(),
                "request", raised.request()));
        return Optional.of(RunOutcome.PENDING_HITL);
    }

    // --- Completion ---

    private RunResult finish(RunState state, RunOutcome outcome, RunEmitter events) {
        if (outcome != RunOutcome.FAILED) {
            state.error = null;
        }
        save(state);

        Map<String, Object> summary = state.summary();
        events.emit(EventType.METRICS, null, summary);
        events.emit(EventType.MESSAGE, null, payload(
                "kind", "run_report",
                "steps", List.copyOf(state.history),
                "summary", summary));

        String pendingRequestId = outcome == RunOutcome.PENDING_HITL ? state.hitl.pendingRequestId() : null;
        events.emit(EventType.COMPLETE, null, payload(
                "outcome", outcome.wireName(),
                "runId", state.runId,
                "threadId", state.threadId,
                "planVersion", state.plan.version(),
                "pendingRequestId", pendingRequestId,
                "error", state.error,
                "facets", new LinkedHashMap<>(state.facets),
                "acceptanceReport", state.acceptanceReport()));

        metrics.recordRunResult(outcome.wireName());
        metrics.recordPlanVersion(state.plan.version());
        log.info("Run {} finished {} at plan v{}", state.runId, outcome.wireName(), state.plan.version());
        return new RunResult(state.runId, state.threadId, outcome, state.plan.version(),
                new LinkedHashMap<>(state.facets), pendingRequestId, state.error, summary);
    }

    private void save(RunState state) {
        if (state.hasThread()) {
            resumeStore.put(state.threadId, state.toSnapshot());
        }
    }

    private void emitPlan(RunState state, String note, RunEmitter events) {
        events.emit(EventType.PROGRESS, null, payload(
                "kind", "plan_update",
                "planVersion", state.plan.version(),
                "steps", state.plan.steps(),
                "note", note));
    }

    static String phaseFor(String capabilityId) {
        if (capabilityId == null) {
            return "execution";
        }
        return switch (capabilityId) {
            case "strategy" -> "analysis";
            case "generation" -> "generation";
            case "qa" -> "qa";
            default -> "execution";
        };
    }

    /** Facet values restricted to {@code names}; an empty set selects everything. */
    private static Map<String, Object> select(Map<String, Object> source, Set<String> names) {
        Map<String, Object> selected = new LinkedHashMap<>();
        source.forEach((name, value) -> {
            if (names.isEmpty() || names.contains(name)) {
                selected.put(name, value);
            }
        });
        return selected;
    }
}
