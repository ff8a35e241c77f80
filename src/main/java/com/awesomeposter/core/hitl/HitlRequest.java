package com.awesomeposter.core.hitl;

import java.io.Serializable;
import java.time.Instant;

/**
 * A recorded request for human input.
 *
 * @param id           request id
 * @param runId        run that raised it
 * @param stepId       step that raised it (the step it resumes)
 * @param capabilityId capability of that step, or null when raised by a policy on a control step
 * @param payload      what was asked
 * @param status       pending, resolved or denied
 * @param denialReason why it was denied, when denied
 * @param createdAt    creation time
 * @param updatedAt    last status change
 */
public record HitlRequest(
    String id,
    String runId,
    String stepId,
    String capabilityId,
    HitlPayload payload,
    HitlStatus status,
    String denialReason,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public HitlRequest withStatus(HitlStatus newStatus, String reason, Instant at) {
        return new HitlRequest(id, runId, stepId, capabilityId, payload, newStatus, reason, createdAt, at);
    }
}
