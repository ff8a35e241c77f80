package com.awesomeposter.core.capability;

import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.model.RunMode;

import java.util.List;
import java.util.Map;

/**
 * Input handed to a capability invocation.
 *
 * @param runId         current run
 * @param stepId        step being executed
 * @param objective     run objective
 * @param mode          run mode
 * @param inputs        facet values the capability is allowed to read
 * @param hitlResponses answers to earlier HITL requests raised by this step
 * @param note          planner note on the step
 */
public record CapabilityContext(
    String runId,
    String stepId,
    String objective,
    RunMode mode,
    Map<String, Object> inputs,
    List<HitlResponse> hitlResponses,
    String note
) {
}
