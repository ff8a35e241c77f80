package com.awesomeposter.core.hitl;

/**
 * Thrown when a request is raised while another is pending, or a response targets a
 * request that is no longer pending.
 */
public class HitlRequestConflictException extends RuntimeException {

    public HitlRequestConflictException(String message) {
        super(message);
    }
}
