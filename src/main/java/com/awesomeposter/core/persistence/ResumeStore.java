package com.awesomeposter.core.persistence;

import java.util.Optional;

/**
 * Keyed store of the last durable snapshot per thread id. The last write wins and the
 * engine never evicts entries.
 */
public interface ResumeStore {

    void put(String threadId, RunSnapshot snapshot);

    Optional<RunSnapshot> get(String threadId);

    default boolean has(String threadId) {
        return get(threadId).isPresent();
    }
}
