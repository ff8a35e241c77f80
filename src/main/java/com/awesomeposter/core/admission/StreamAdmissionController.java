package com.awesomeposter.core.admission;

import com.awesomeposter.core.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gatekeeper for long-lived run streams.
 * <p>
 * Every admitted stream counts as pending until its permit is closed. A stream is rejected
 * when the pending count already meets the ceiling, before anything stream-specific is
 * allocated. Admitted streams then compete for a fixed number of run slots.
 */
@Component
public class StreamAdmissionController {

    private static final Logger log = LoggerFactory.getLogger(StreamAdmissionController.class);

    private final int maxPending;
    private final int concurrency;
    private final int retryAfterSeconds;
    private final AtomicInteger pending = new AtomicInteger();
    private final Semaphore slots;
    private final OrchestratorMetrics metrics;

    @Autowired
    public StreamAdmissionController(StreamingProperties properties, OrchestratorMetrics metrics) {
        this(properties.getMaxPending(), properties.getConcurrency(), properties.getRetryAfterSeconds(), metrics);
    }

    StreamAdmissionController(int maxPending, int concurrency, int retryAfterSeconds, OrchestratorMetrics metrics) {
        this.maxPending = Math.max(0, maxPending);
        this.concurrency = Math.max(1, concurrency);
        this.retryAfterSeconds = retryAfterSeconds;
        this.slots = new Semaphore(this.concurrency, true);
        this.metrics = metrics;
        metrics.registerActiveStreams(pending::get);
    }

    /**
     * Claims a place in the backlog.
     *
     * @throws ServerBusyException when the backlog is full
     */
    public StreamPermit admit() {
        while (true) {
            int current = pending.get();
            if (current >= maxPending) {
                BacklogSnapshot snapshot = new BacklogSnapshot(used(), current, maxPending);
                log.warn("sse_backlog_reject pending={} limit={}", current, maxPending);
                metrics.recordAdmissionRejected();
                throw new ServerBusyException(snapshot, retryAfterSeconds);
            }
            if (pending.compareAndSet(current, current + 1)) {
                return new StreamPermit(pending, slots);
            }
        }
    }

    public BacklogSnapshot snapshot() {
        return new BacklogSnapshot(used(), pending.get(), maxPending);
    }

    public boolean isBacklogFull() {
        return snapshot().full();
    }

    private int used() {
        return concurrency - slots.availablePermits();
    }
}
