package com.awesomeposter.dispatch.api;

import com.awesomeposter.core.events.RunEvent;
import com.awesomeposter.core.events.RunEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One client's SSE stream for a run.
 * <p>
 * Events are written in the order {@link #onEvent} is called, each with the next sequence id
 * starting at 1. Heartbeats are comment frames and carry no id. Once the client goes away or
 * a terminal event is written, further events are dropped.
 */
public class RunEventStream implements RunEventSink {

    private static final Logger log = LoggerFactory.getLogger(RunEventStream.class);

    private final String runId;
    private final SseEmitter emitter;
    private long sequence;
    private boolean closed;

    RunEventStream(String runId, SseEmitter emitter) {
        this.runId = runId;
        this.emitter = emitter;
    }

    @Override
    public synchronized void onEvent(RunEvent event) {
        if (closed) {
            return;
        }
        long id = sequence + 1;
        try {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(id))
                    .name(event.type().wireName())
                    .data(frameData(event), MediaType.APPLICATION_JSON));
            sequence = id;
        } catch (IOException | IllegalStateException e) {
            log.debug("Stream for run {} closed while sending {}: {}", runId, event.type().wireName(), e.getMessage());
            closed = true;
            return;
        }
        if (event.type().isTerminal()) {
            complete();
        }
    }

    synchronized void heartbeat() {
        if (closed) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().comment("heartbeat"));
        } catch (IOException | IllegalStateException e) {
            log.debug("Heartbeat failed for run {} (connection likely closed): {}", runId, e.getMessage());
            closed = true;
        }
    }

    /** Ends the stream normally. */
    public synchronized void complete() {
        if (!closed) {
            closed = true;
            emitter.complete();
        }
    }

    synchronized void detach() {
        closed = true;
    }

    public synchronized long lastSequence() {
        return sequence;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String runId() {
        return runId;
    }

    public SseEmitter emitter() {
        return emitter;
    }

    private static Map<String, Object> frameData(RunEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", event.runId());
        if (event.stepId() != null) {
            data.put("stepId", event.stepId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }
}
