package com.awesomeposter.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for run events.
 * <p>
 * The primary consumer of a run's events is the {@link RunEventSink} handed to the run loop.
 * The bus lets additional observers (extra SSE clients, CLI watchers) follow a run by id,
 * or all runs through a global subscription.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RunEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<RunEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(RunEvent event) {
        log.debug("Publishing {} for run {}", event.type().wireName(), event.runId());

        List<Consumer<RunEvent>> subs = runSubscribers.get(event.runId());
        if (subs != null) {
            for (Consumer<RunEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<RunEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<RunEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String runId) {
        List<Consumer<RunEvent>> subs = runSubscribers.get(runId);
        return subs != null ? subs.size() : 0;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RunEvent> subscriber, RunEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
