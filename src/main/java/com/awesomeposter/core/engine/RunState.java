package com.awesomeposter.core.engine;

import com.awesomeposter.core.guard.GuardResult;
import com.awesomeposter.core.hitl.HitlRunState;
import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.model.StepResult;
import com.awesomeposter.core.model.StepStatus;
import com.awesomeposter.core.persistence.RunSnapshot;
import com.awesomeposter.core.policy.RuntimePolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working state of one run. Owned by the thread executing the run; never shared.
 */
final class RunState {

    final String runId;
    final String threadId;
    final String objective;
    final RunMode mode;
    final boolean resumed;
    final long startedAt = System.currentTimeMillis();

    Plan plan;
    HitlRunState hitl;
    final Map<String, Object> facets = new LinkedHashMap<>();
    final List<StepResult> history = new ArrayList<>();
    final Map<String, GuardResult> guardResults = new LinkedHashMap<>();
    final Map<String, Integer> attempts = new HashMap<>();
    List<Map<String, Object>> rawPolicies = List.of();
    List<RuntimePolicy> policies = List.of();

    String awaitingRequestId;
    String preferredNext;
    String replanRationale;
    String error;

    private RunState(String runId, String threadId, String objective, RunMode mode, boolean resumed,
                     Plan plan, HitlRunState hitl) {
        this.runId = runId;
        this.threadId = threadId;
        this.objective = objective;
        this.mode = mode;
        this.resumed = resumed;
        this.plan = plan;
        this.hitl = hitl;
    }

    static RunState fresh(String runId, RunRequest request) {
        RunState state = new RunState(runId, request.threadId(), request.objective(), request.mode(), false,
                Plan.empty(), HitlRunState.empty());
        state.facets.put("objective", request.objective());
        state.facets.putAll(request.facets());
        return state;
    }

    static RunState resume(String runId, RunRequest request, RunSnapshot snapshot) {
        String objective = request.objective() != null && !request.objective().isBlank()
                ? request.objective() : snapshot.objective();
        RunMode mode = snapshot.mode() != null ? snapshot.mode() : request.mode();
        RunState state = new RunState(runId, request.threadId(), objective, mode, true,
                snapshot.plan(), snapshot.hitl());
        state.facets.putAll(snapshot.facets());
        state.facets.putIfAbsent("objective", objective);
        state.facets.putAll(request.facets());
        state.history.addAll(snapshot.history());
        snapshot.guardResults().forEach(g -> state.guardResults.put(g.facet() + "#" + g.path(), g));
        state.awaitingRequestId = snapshot.awaitingRequestId();
        return state;
    }

    boolean hasThread() {
        return threadId != null && !threadId.isBlank();
    }

    int nextAttempt(String target) {
        return attempts.merge(target, 1, Integer::sum);
    }

    void record(GuardResult result) {
        guardResults.put(result.facet() + "#" + result.path(), result);
    }

    RunSnapshot toSnapshot() {
        return new RunSnapshot(runId, threadId, objective, mode, plan, new LinkedHashMap<>(facets), hitl,
                List.copyOf(history), List.copyOf(guardResults.values()), rawPolicies, awaitingRequestId,
                Instant.now());
    }

    Map<String, Object> summary() {
        long failures = history.stream().filter(r -> r.status() == StepStatus.FAILED).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("steps", history.size());
        summary.put("failures", failures);
        summary.put("durationMs", System.currentTimeMillis() - startedAt);
        summary.put("stepDurationMs", history.stream().mapToLong(StepResult::durationMs).sum());
        summary.put("planVersion", plan.version());
        summary.put("hitlRequests", hitl.requests().size());
        summary.put("hitlDenied", hitl.deniedCount());
        return summary;
    }

    Map<String, Object> acceptanceReport() {
        List<GuardResult> criteria = List.copyOf(guardResults.values());
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("criteria", criteria);
        report.put("passed", criteria.stream().allMatch(GuardResult::passed));
        return report;
    }
}
