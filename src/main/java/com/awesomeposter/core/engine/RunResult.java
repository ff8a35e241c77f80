package com.awesomeposter.core.engine;

import java.util.Map;

/**
 * @param pendingRequestId the HITL request to answer, set only for {@link RunOutcome#PENDING_HITL}
 * @param error            failure or error message, null otherwise
 * @param summary          step counts and timings from the run report
 */
public record RunResult(
    String runId,
    String threadId,
    RunOutcome outcome,
    int planVersion,
    Map<String, Object> facets,
    String pendingRequestId,
    String error,
    Map<String, Object> summary
) {
    public RunResult {
        facets = facets != null ? facets : Map.of();
        summary = summary != null ? summary : Map.of();
    }
}
