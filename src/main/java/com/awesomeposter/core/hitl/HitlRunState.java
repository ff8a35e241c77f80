package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Per-run HITL bookkeeping. Immutable; {@link HitlGate} returns updated copies.
 *
 * @param requests         every request raised by the run, oldest first
 * @param responses        every response recorded, oldest first
 * @param pendingRequestId the one outstanding request, or null
 * @param deniedCount      number of denied requests, including those over the limit
 */
public record HitlRunState(
    List<HitlRequest> requests,
    List<HitlResponse> responses,
    String pendingRequestId,
    int deniedCount
) implements Serializable {

    public HitlRunState {
        requests = requests != null ? List.copyOf(requests) : List.of();
        responses = responses != null ? List.copyOf(responses) : List.of();
    }

    public static HitlRunState empty() {
        return new HitlRunState(List.of(), List.of(), null, 0);
    }

    public Optional<HitlRequest> find(String requestId) {
        return requests.stream().filter(r -> r.id().equals(requestId)).findFirst();
    }

    @JsonIgnore
    public Optional<HitlRequest> pending() {
        return pendingRequestId != null ? find(pendingRequestId) : Optional.empty();
    }

    public List<HitlResponse> responsesFor(String requestId) {
        return responses.stream().filter(r -> r.requestId().equals(requestId)).toList();
    }

    /** Responses to requests raised by the given step. */
    public List<HitlResponse> responsesForStep(String stepId) {
        List<String> ids = requests.stream().filter(r -> stepId.equals(r.stepId())).map(HitlRequest::id).toList();
        return responses.stream().filter(r -> ids.contains(r.requestId())).toList();
    }
}
