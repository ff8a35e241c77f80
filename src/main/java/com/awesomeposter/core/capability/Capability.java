package com.awesomeposter.core.capability;

/**
 * A unit of work the run loop can schedule. The engine does not look into how outputs
 * are computed.
 */
public interface Capability {

    CapabilityRegistration registration();

    /**
     * @throws CapabilityException when the capability cannot produce its outputs
     */
    CapabilityResult invoke(CapabilityContext context);

    default String id() {
        return registration().id();
    }
}
