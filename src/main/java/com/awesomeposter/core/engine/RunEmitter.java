package com.awesomeposter.core.engine;

import com.awesomeposter.core.events.EventBus;
import com.awesomeposter.core.events.EventType;
import com.awesomeposter.core.events.RunEvent;
import com.awesomeposter.core.events.RunEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends one run's events to its sink and to the {@link EventBus}, in production order.
 * <p>
 * A sink that throws is detached and the run carries on; the bus keeps receiving events.
 * At most one terminal event is ever sent.
 */
final class RunEmitter {

    private static final Logger log = LoggerFactory.getLogger(RunEmitter.class);

    private final String runId;
    private final RunEventSink sink;
    private final EventBus eventBus;
    private boolean sinkAttached = true;
    private boolean terminated;

    RunEmitter(String runId, RunEventSink sink, EventBus eventBus) {
        this.runId = runId;
        this.sink = sink != null ? sink : RunEventSink.NOOP;
        this.eventBus = eventBus;
    }

    void emit(EventType type, String stepId, Map<String, Object> payload) {
        if (terminated) {
            log.warn("Dropping {} event after run {} terminated", type.wireName(), runId);
            return;
        }
        terminated = type.isTerminal();
        RunEvent event = RunEvent.of(type, runId, stepId, payload);
        if (sinkAttached) {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                sinkAttached = false;
                log.warn("Event sink for run {} failed, detaching it: {}", runId, e.getMessage());
            }
        }
        eventBus.publish(event);
    }

    boolean terminated() {
        return terminated;
    }

    /** Builds a payload map in argument order, skipping null values. */
    static Map<String, Object> payload(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                map.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return map;
    }
}
