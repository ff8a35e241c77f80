package com.awesomeposter.dispatch.api;

import com.awesomeposter.core.engine.HitlService;
import com.awesomeposter.core.engine.ThreadNotFoundException;
import com.awesomeposter.core.hitl.HitlRequest;
import com.awesomeposter.core.hitl.HitlRequestConflictException;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.hitl.UnknownHitlRequestException;
import com.awesomeposter.core.persistence.RunSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for stored thread state and out-of-band HITL answers.
 */
@RestController
@RequestMapping("/api/v1/threads")
public class ThreadController {

    private final HitlService hitlService;

    public ThreadController(HitlService hitlService) {
        this.hitlService = hitlService;
    }

    /**
     * GET /api/v1/threads/{threadId} — The latest snapshot stored for the thread.
     */
    @GetMapping("/{threadId}")
    public ResponseEntity<RunSnapshot> getThread(@PathVariable String threadId) {
        return ResponseEntity.ok(hitlService.snapshot(threadId));
    }

    /**
     * GET /api/v1/threads/{threadId}/hitl/pending — Requests waiting for an answer.
     */
    @GetMapping("/{threadId}/hitl/pending")
    public ResponseEntity<List<HitlRequest>> pending(@PathVariable String threadId) {
        return ResponseEntity.ok(hitlService.pendingRequests(threadId));
    }

    /**
     * POST /api/v1/threads/{threadId}/hitl/resolve — Answer a pending request. The run picks
     * the answer up when the thread is next streamed.
     */
    @PostMapping("/{threadId}/hitl/resolve")
    public ResponseEntity<HitlRequest> resolve(@PathVariable String threadId, @RequestBody HitlResponse response) {
        return ResponseEntity.ok(hitlService.resolve(threadId, response));
    }

    @ExceptionHandler({ThreadNotFoundException.class, UnknownHitlRequestException.class})
    ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(HitlRequestConflictException.class)
    ResponseEntity<Map<String, String>> conflict(HitlRequestConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
