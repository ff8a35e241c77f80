package com.awesomeposter.core.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An admitted stream's place in the backlog. Holds the pending count from admission and,
 * once {@link #acquireSlot()} returns, one run slot. {@link #close()} releases both and is
 * safe to call more than once.
 */
public final class StreamPermit implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamPermit.class);

    private final AtomicInteger pending;
    private final Semaphore slots;
    private final AtomicBoolean slotHeld = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    StreamPermit(AtomicInteger pending, Semaphore slots) {
        this.pending = pending;
        this.slots = slots;
    }

    /**
     * Waits for a run slot.
     *
     * @throws IllegalStateException if the permit was already closed
     */
    public void acquireSlot() throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("Stream permit already released");
        }
        if (!slots.tryAcquire()) {
            log.info("sse_queue pending={} available={}", pending.get(), slots.availablePermits());
            slots.acquire();
        }
        slotHeld.set(true);
        if (closed.get() && slotHeld.compareAndSet(true, false)) {
            slots.release();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (slotHeld.compareAndSet(true, false)) {
            slots.release();
        }
        pending.decrementAndGet();
    }
}
