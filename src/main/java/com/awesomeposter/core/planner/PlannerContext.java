package com.awesomeposter.core.planner;

import com.awesomeposter.core.capability.CapabilityRegistration;
import com.awesomeposter.core.model.Plan;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.model.StepResult;

import java.util.List;
import java.util.Map;

/**
 * What the planner sees when asked for the next delta.
 *
 * @param replanRationale set when a policy asked for a replan, otherwise null
 */
public record PlannerContext(
    String runId,
    String objective,
    RunMode mode,
    Plan plan,
    Map<String, Object> facets,
    List<StepResult> history,
    String replanRationale,
    List<CapabilityRegistration> capabilities
) {
}
