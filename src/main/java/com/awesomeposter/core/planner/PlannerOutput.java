package com.awesomeposter.core.planner;

import java.util.List;

/**
 * Raw planner reply. Fields are loose strings; {@link PlanDeltaNormalizer} turns them
 * into a {@link com.awesomeposter.core.model.PlanDelta}.
 */
public record PlannerOutput(
    List<ProposedStep> stepsAdd,
    List<ProposedUpdate> stepsUpdate,
    String note
) {

    public record ProposedStep(
        String id,
        String capabilityId,
        String action,
        String label,
        String status,
        String note
    ) {}

    public record ProposedUpdate(
        String id,
        String status,
        String note
    ) {}
}
