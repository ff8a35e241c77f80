package com.awesomeposter.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during run execution, used for SSE streaming and CLI output.
 *
 * @param type      event type
 * @param runId     the run this event belongs to
 * @param stepId    the plan step this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RunEvent(
    EventType type,
    String runId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public RunEvent {
        payload = payload != null ? payload : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static RunEvent of(EventType type, String runId, String stepId, Map<String, Object> payload) {
        return new RunEvent(type, runId, stepId, payload, Instant.now());
    }
}
