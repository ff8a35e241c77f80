package com.awesomeposter.core.capability;

public class CapabilityRegistrationException extends RuntimeException {

    public CapabilityRegistrationException(String message) {
        super(message);
    }
}
