package com.awesomeposter.core.engine;

import com.awesomeposter.core.hitl.HitlGate;
import com.awesomeposter.core.hitl.HitlRequest;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.hitl.HitlRunState;
import com.awesomeposter.core.metrics.OrchestratorMetrics;
import com.awesomeposter.core.persistence.ResumeStore;
import com.awesomeposter.core.persistence.RunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers HITL requests out of band, against the snapshot stored for a thread. The answer
 * takes effect when the thread is next run.
 */
@Service
public class HitlService {

    private static final Logger log = LoggerFactory.getLogger(HitlService.class);

    private final ResumeStore resumeStore;
    private final HitlGate hitlGate;
    private final OrchestratorMetrics metrics;

    public HitlService(ResumeStore resumeStore, HitlGate hitlGate, OrchestratorMetrics metrics) {
        this.resumeStore = resumeStore;
        this.hitlGate = hitlGate;
        this.metrics = metrics;
    }

    /**
     * @return the request after the response was applied
     * @throws ThreadNotFoundException if nothing is stored for the thread
     */
    public synchronized HitlRequest resolve(String threadId, HitlResponse response) {
        RunSnapshot snapshot = snapshot(threadId);
        HitlRunState updated = hitlGate.resolve(snapshot.hitl(), response);
        resumeStore.put(threadId, snapshot.withHitl(updated));
        if (response.isDenial()) {
            metrics.recordHitlDenial();
        }
        HitlRequest request = updated.find(response.requestId()).orElseThrow();
        log.info("Thread {} request {} is now {}", threadId, request.id(), request.status().wireName());
        return request;
    }

    public List<HitlRequest> pendingRequests(String threadId) {
        return snapshot(threadId).hitl().pending().stream().toList();
    }

    public RunSnapshot snapshot(String threadId) {
        return resumeStore.get(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
    }
}
