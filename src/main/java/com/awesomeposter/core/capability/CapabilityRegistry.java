package com.awesomeposter.core.capability;

import com.awesomeposter.core.guard.GuardDefinition;
import com.fasterxml.jackson.core.JsonPointer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capabilities available to the planner and the run loop, keyed by id.
 * <p>
 * Registration validates the capability's guards: each (facet, path) pair may appear once,
 * a path must be a valid JSON pointer, and a guard may only inspect a declared output facet.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> capabilities = new LinkedHashMap<>();

    public CapabilityRegistry() {
    }

    public CapabilityRegistry(Collection<? extends Capability> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws CapabilityRegistrationException for a duplicate id or an invalid guard set
     */
    public synchronized void register(Capability capability) {
        CapabilityRegistration registration = capability.registration();
        String id = registration.id();
        if (id == null || id.isBlank()) {
            throw new CapabilityRegistrationException("Capability id is required");
        }
        if (capabilities.containsKey(id)) {
            throw new CapabilityRegistrationException("Capability '" + id + "' is already registered");
        }
        validateGuards(registration);
        capabilities.put(id, capability);
        log.info("Registered capability {} ({} guards, outputs {})",
                id, registration.guards().size(), registration.outputFacets());
    }

    public synchronized Optional<Capability> find(String id) {
        return Optional.ofNullable(capabilities.get(id));
    }

    public synchronized List<CapabilityRegistration> registrations() {
        return capabilities.values().stream().map(Capability::registration).toList();
    }

    public synchronized Set<String> ids() {
        return Set.copyOf(capabilities.keySet());
    }

    private static void validateGuards(CapabilityRegistration registration) {
        Set<String> keys = new HashSet<>();
        for (GuardDefinition guard : registration.guards()) {
            if (!keys.add(guard.key())) {
                throw new CapabilityRegistrationException("Capability '" + registration.id()
                        + "' declares more than one guard for facet '" + guard.facet()
                        + "' at path '" + guard.path() + "'");
            }
            if (!guard.path().isEmpty()) {
                try {
                    JsonPointer.compile(guard.path());
                } catch (IllegalArgumentException e) {
                    throw new CapabilityRegistrationException("Capability '" + registration.id()
                            + "' declares a guard on facet '" + guard.facet() + "' with invalid path '"
                            + guard.path() + "': a JSON pointer must be empty or start with '/'");
                }
            }
            if (!registration.outputFacets().isEmpty() && !registration.outputFacets().contains(guard.facet())) {
                throw new CapabilityRegistrationException("Capability '" + registration.id()
                        + "' declares a guard on facet '" + guard.facet() + "' which is not one of its outputs "
                        + registration.outputFacets());
            }
        }
    }
}
