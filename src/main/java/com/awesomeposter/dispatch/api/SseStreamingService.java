package com.awesomeposter.dispatch.api;

import com.awesomeposter.core.admission.StreamPermit;
import com.awesomeposter.core.admission.StreamingProperties;
import com.awesomeposter.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates SSE streams for runs and keeps them alive.
 * <p>
 * A run stream is the sink the run loop writes to directly. An observer stream follows a
 * run through the {@link EventBus}. Either way the stream owns an admission permit which is
 * closed when the emitter completes, times out or errors, so a client disconnect always
 * frees its backlog place. Heartbeat comment frames go to every open stream on a fixed
 * interval.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final long heartbeatIntervalMs;

    private final CopyOnWriteArrayList<StreamRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, StreamingProperties properties) {
        this(eventBus, properties.getEmitterTimeout(), properties.getHeartbeatInterval());
    }

    SseStreamingService(EventBus eventBus, Duration timeout, Duration heartbeatInterval) {
        this.eventBus = eventBus;
        this.timeoutMs = timeout.toMillis();
        this.heartbeatIntervalMs = heartbeatInterval.toMillis();
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", heartbeatIntervalMs);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE streams", activeRegistrations.size());
        for (StreamRegistration registration : activeRegistrations) {
            registration.stream().heartbeat();
        }
    }

    /**
     * Opens the stream a run loop writes to.
     */
    public RunEventStream openRunStream(String runId, StreamPermit permit) {
        return open(runId, new SseEmitter(timeoutMs), permit, false);
    }

    /**
     * Opens a stream that follows a run started elsewhere.
     */
    public RunEventStream openObserverStream(String runId, StreamPermit permit) {
        return open(runId, new SseEmitter(timeoutMs), permit, true);
    }

    RunEventStream open(String runId, SseEmitter emitter, StreamPermit permit, boolean observe) {
        RunEventStream stream = new RunEventStream(runId, emitter);
        EventBus.Subscription subscription = observe ? eventBus.subscribe(runId, stream::onEvent) : null;

        var registration = new StreamRegistration(runId, stream, permit, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE stream completed for run {}", runId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE stream timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE stream error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE {} stream opened for run {} (timeout={}ms)", observe ? "observer" : "run", runId, timeoutMs);
        return stream;
    }

    public int activeStreamCount() {
        return activeRegistrations.size();
    }

    private void cleanup(StreamRegistration registration) {
        if (!activeRegistrations.remove(registration)) {
            return;
        }
        registration.stream().detach();
        if (registration.subscription() != null) {
            registration.subscription().unsubscribe();
        }
        registration.permit().close();
        log.debug("Cleaned up SSE registration for run {}", registration.runId());
    }

    private record StreamRegistration(
            String runId,
            RunEventStream stream,
            StreamPermit permit,
            EventBus.Subscription subscription
    ) {}
}
