package com.awesomeposter.core.hitl;

public class UnknownHitlRequestException extends RuntimeException {

    public UnknownHitlRequestException(String requestId) {
        super("Unknown HITL request: " + requestId);
    }
}
