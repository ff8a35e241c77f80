package com.awesomeposter.core.admission;

/**
 * Point-in-time view of the stream backlog.
 *
 * @param used    run slots currently held
 * @param pending streams open or queued
 * @param limit   admission ceiling
 */
public record BacklogSnapshot(int used, int pending, int limit) {

    public boolean full() {
        return pending >= limit;
    }
}
