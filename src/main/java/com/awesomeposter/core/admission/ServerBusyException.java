package com.awesomeposter.core.admission;

/**
 * Thrown when a stream is refused because the backlog is at its ceiling. Retryable.
 */
public class ServerBusyException extends RuntimeException {

    private final BacklogSnapshot snapshot;
    private final int retryAfterSeconds;

    public ServerBusyException(BacklogSnapshot snapshot, int retryAfterSeconds) {
        super("Server busy. Please retry.");
        this.snapshot = snapshot;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public BacklogSnapshot getSnapshot() {
        return snapshot;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
