package com.awesomeposter.core.hitl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Raises and resolves human-in-the-loop requests against a run's {@link HitlRunState}.
 * <p>
 * At most one request may be pending per run. Requests beyond the per-run limit are not
 * raised: they are recorded as denied with {@link #LIMIT_REASON} and the run carries on.
 */
public class HitlGate {

    private static final Logger log = LoggerFactory.getLogger(HitlGate.class);

    public static final String LIMIT_REASON = "Too many HITL requests";

    private final int maxRequestsPerRun;
    private final Clock clock;

    public HitlGate(int maxRequestsPerRun) {
        this(maxRequestsPerRun, Clock.systemUTC());
    }

    HitlGate(int maxRequestsPerRun, Clock clock) {
        this.maxRequestsPerRun = maxRequestsPerRun;
        this.clock = clock;
    }

    /**
     * Outcome of {@link #raise}: the updated state and the recorded request, which is either
     * pending or denied because the limit was reached.
     */
    public record Raised(HitlRunState state, HitlRequest request) {
        public boolean accepted() {
            return request.status() == HitlStatus.PENDING;
        }
    }

    /**
     * @throws HitlRequestConflictException if a request is already pending
     */
    public Raised raise(HitlRunState state, String runId, String stepId, String capabilityId, HitlPayload payload) {
        if (state.pendingRequestId() != null) {
            throw new HitlRequestConflictException("HITL request " + state.pendingRequestId()
                    + " is still pending; resolve or deny it before raising another");
        }
        Instant now = clock.instant();
        HitlRequest request = new HitlRequest(UUID.randomUUID().toString(), runId, stepId, capabilityId,
                payload, HitlStatus.PENDING, null, now, now);

        long accepted = state.requests().stream().filter(r -> !LIMIT_REASON.equals(r.denialReason())).count();
        List<HitlRequest> requests = new ArrayList<>(state.requests());
        if (accepted >= maxRequestsPerRun) {
            HitlRequest denied = request.withStatus(HitlStatus.DENIED, LIMIT_REASON, now);
            requests.add(denied);
            log.info("hitl_request_denied request={} step={} limitUsed={} limitMax={}",
                    denied.id(), stepId, accepted, maxRequestsPerRun);
            return new Raised(new HitlRunState(requests, state.responses(), null, state.deniedCount() + 1), denied);
        }

        requests.add(request);
        log.info("hitl_request_created request={} step={} kind={} limitUsed={} limitMax={}",
                request.id(), stepId, payload.kind().wireName(), accepted + 1, maxRequestsPerRun);
        return new Raised(new HitlRunState(requests, state.responses(), request.id(), state.deniedCount()), request);
    }

    /**
     * Records a response and moves its request to resolved, or denied when the response is a denial.
     *
     * @throws UnknownHitlRequestException  if the request does not belong to this run
     * @throws HitlRequestConflictException if the request is no longer pending
     */
    public HitlRunState resolve(HitlRunState state, HitlResponse response) {
        HitlRequest request = state.find(response.requestId())
                .orElseThrow(() -> new UnknownHitlRequestException(response.requestId()));
        if (request.status() != HitlStatus.PENDING) {
            throw new HitlRequestConflictException("HITL request " + request.id() + " is already "
                    + request.status().wireName());
        }
        Instant now = clock.instant();
        boolean denied = response.isDenial();
        HitlRequest updated = denied
                ? request.withStatus(HitlStatus.DENIED, reason(response), now)
                : request.withStatus(HitlStatus.RESOLVED, null, now);

        List<HitlRequest> requests = state.requests().stream()
                .map(r -> r.id().equals(updated.id()) ? updated : r)
                .toList();
        List<HitlResponse> responses = new ArrayList<>(state.responses());
        responses.add(response.stamped(UUID.randomUUID().toString(), now));
        String pending = request.id().equals(state.pendingRequestId()) ? null : state.pendingRequestId();

        log.info("hitl_response_recorded request={} type={} status={}",
                request.id(), response.responseType().wireName(), updated.status().wireName());
        return new HitlRunState(requests, responses, pending, state.deniedCount() + (denied ? 1 : 0));
    }

    public int getMaxRequestsPerRun() {
        return maxRequestsPerRun;
    }

    private static String reason(HitlResponse response) {
        if (response.freeformText() != null && !response.freeformText().isBlank()) {
            return response.freeformText();
        }
        return "Denied by " + (response.responderId() != null ? response.responderId() : "operator");
    }
}
