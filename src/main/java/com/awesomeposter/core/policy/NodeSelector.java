package com.awesomeposter.core.policy;

import java.io.Serializable;

/**
 * Optional filter on the node a lifecycle event is about. Absent fields match anything.
 */
public record NodeSelector(String nodeId, String capabilityId) implements Serializable {

    public static final NodeSelector ANY = new NodeSelector(null, null);

    public boolean matches(String eventNodeId, String eventCapabilityId) {
        return (nodeId == null || nodeId.equals(eventNodeId))
                && (capabilityId == null || capabilityId.equals(eventCapabilityId));
    }
}
