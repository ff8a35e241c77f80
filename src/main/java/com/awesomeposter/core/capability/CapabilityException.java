package com.awesomeposter.core.capability;

/**
 * Thrown by a capability that failed. The run loop records it on the step.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
