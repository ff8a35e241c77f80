package com.awesomeposter.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Outcome of one step execution, kept in the run history for reporting.
 *
 * @param stepId       the step that ran
 * @param capabilityId capability or control action it targeted
 * @param status       status the step ended in
 * @param output       facets produced
 * @param error        failure reason, null on success
 * @param durationMs   wall time spent in the capability
 * @param attempt      1-based count of executions of this step target within the run
 */
public record StepResult(
    String stepId,
    String capabilityId,
    StepStatus status,
    Map<String, Object> output,
    String error,
    long durationMs,
    int attempt
) implements Serializable {

    public StepResult {
        output = output != null ? output : Map.of();
    }
}
