package com.awesomeposter.core.events;

/**
 * Ordered callback the run loop reports its events to. Implementations must not reorder events.
 */
@FunctionalInterface
public interface RunEventSink {

    RunEventSink NOOP = event -> { };

    void onEvent(RunEvent event);
}
