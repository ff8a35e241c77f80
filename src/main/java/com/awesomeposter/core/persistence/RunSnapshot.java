package com.awesomeposter.core.persistence;

import com.awesomeposter.core.guard.GuardResult;
import com.awesomeposter.core.hitl.HitlRunState;
import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.model.StepResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to continue a run later under the same thread id.
 *
 * @param runId             run that wrote the snapshot
 * @param threadId          resume key
 * @param objective         the run's objective
 * @param mode              the run's mode
 * @param plan              latest plan revision
 * @param facets            accumulated facet values
 * @param hitl              HITL requests and responses
 * @param history           step results across all runs on this thread
 * @param guardResults      latest guard results, used for the acceptance report
 * @param policies          runtime policies in their raw form, reapplied on resume
 * @param awaitingRequestId request the run stopped on, cleared once its answer is applied
 * @param updatedAt         write time
 */
public record RunSnapshot(
    String runId,
    String threadId,
    String objective,
    RunMode mode,
    Plan plan,
    Map<String, Object> facets,
    HitlRunState hitl,
    List<StepResult> history,
    List<GuardResult> guardResults,
    List<Map<String, Object>> policies,
    String awaitingRequestId,
    Instant updatedAt
) implements Serializable {

    public RunSnapshot {
        plan = plan != null ? plan : Plan.empty();
        facets = facets != null ? facets : Map.of();
        hitl = hitl != null ? hitl : HitlRunState.empty();
        history = history != null ? history : List.of();
        guardResults = guardResults != null ? guardResults : List.of();
        policies = policies != null ? policies : List.of();
    }

    public RunSnapshot withHitl(HitlRunState newHitl) {
        return new RunSnapshot(runId, threadId, objective, mode, plan, facets, newHitl, history, guardResults,
                policies, awaitingRequestId, Instant.now());
    }
}
