package com.awesomeposter.dispatch.api;

import com.awesomeposter.core.admission.BacklogSnapshot;
import com.awesomeposter.core.admission.ServerBusyException;
import com.awesomeposter.core.admission.StreamAdmissionController;
import com.awesomeposter.core.admission.StreamPermit;
import com.awesomeposter.core.engine.OrchestratorEngine;
import com.awesomeposter.core.engine.RunRequest;
import com.awesomeposter.core.events.EventType;
import com.awesomeposter.core.events.RunEvent;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.policy.PolicyConfigurationException;
import com.awesomeposter.core.policy.RuntimePolicyParser;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * REST/SSE surface for runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final OrchestratorEngine engine;
    private final RuntimePolicyParser policyParser;
    private final StreamAdmissionController admission;
    private final SseStreamingService sseStreamingService;

    private final AtomicInteger workerCounter = new AtomicInteger();
    private final ExecutorService runExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "run-worker-" + workerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public RunController(OrchestratorEngine engine,
                         RuntimePolicyParser policyParser,
                         StreamAdmissionController admission,
                         SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.policyParser = policyParser;
        this.admission = admission;
        this.sseStreamingService = sseStreamingService;
    }

    @PreDestroy
    void shutdown() {
        runExecutor.shutdownNow();
    }

    /**
     * POST /api/v1/runs/stream — Run (or resume) an objective and stream its events as SSE.
     * Rejected with 503 when the stream backlog is full.
     */
    @PostMapping("/stream")
    public ResponseEntity<?> stream(@RequestBody RunStreamRequest body,
                                    @RequestHeader(value = CORRELATION_HEADER, required = false) String correlationId) {
        RunMode mode;
        try {
            mode = RunMode.fromWire(body.mode());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        boolean hasThread = body.threadId() != null && !body.threadId().isBlank();
        if ((body.objective() == null || body.objective().isBlank()) && !hasThread) {
            return error(HttpStatus.BAD_REQUEST, "objective is required");
        }
        try {
            policyParser.parse(body.policies());
        } catch (PolicyConfigurationException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        StreamPermit permit;
        try {
            permit = admission.admit();
        } catch (ServerBusyException e) {
            return busy(e);
        }

        String correlation = correlationId != null && !correlationId.isBlank()
                ? correlationId : UUID.randomUUID().toString();
        String runId = engine.generateRunId();
        RunRequest request = new RunRequest(body.objective(), mode, body.threadId(), body.facets(),
                body.policies(), body.hitlResponses(), body.manualTrigger());
        RunEventStream stream = sseStreamingService.openRunStream(runId, permit);
        log.info("Accepted run {} (correlation {}), backlog {}", runId, correlation, admission.snapshot());

        CompletableFuture.runAsync(() -> {
            try {
                permit.acquireSlot();
                engine.run(runId, request, stream, correlation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stream.onEvent(RunEvent.of(EventType.ERROR, runId, null,
                        Map.of("runId", runId, "message", "Interrupted while waiting for a run slot")));
            } catch (RuntimeException e) {
                log.error("Run {} could not be executed", runId, e);
                stream.onEvent(RunEvent.of(EventType.ERROR, runId, null,
                        Map.of("runId", runId, "message", String.valueOf(e.getMessage()))));
            } finally {
                permit.close();
                stream.complete();
            }
        }, runExecutor);

        return ResponseEntity.ok()
                .header("X-Run-Id", runId)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(stream.emitter());
    }

    /**
     * GET /api/v1/runs/{runId}/events — Follow a run started by another client.
     */
    @GetMapping("/{runId}/events")
    public ResponseEntity<?> observe(@PathVariable String runId) {
        StreamPermit permit;
        try {
            permit = admission.admit();
        } catch (ServerBusyException e) {
            return busy(e);
        }
        RunEventStream stream = sseStreamingService.openObserverStream(runId, permit);
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(stream.emitter());
    }

    /**
     * GET /api/v1/runs/backlog — Current stream backlog.
     */
    @GetMapping("/backlog")
    public ResponseEntity<Map<String, Object>> backlog() {
        BacklogSnapshot snapshot = admission.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("used", snapshot.used());
        body.put("pending", snapshot.pending());
        body.put("limit", snapshot.limit());
        body.put("full", snapshot.full());
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> busy(ServerBusyException e) {
        BacklogSnapshot snapshot = e.getSnapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("pending", snapshot.pending());
        body.put("limit", snapshot.limit());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .header("X-Backlog-Pending", String.valueOf(snapshot.pending()))
                .header("X-Backlog-Limit", String.valueOf(snapshot.limit()))
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
