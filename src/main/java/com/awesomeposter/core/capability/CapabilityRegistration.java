package com.awesomeposter.core.capability;

import com.awesomeposter.core.guard.GuardDefinition;

import java.util.List;
import java.util.Set;

/**
 * Declares what a capability is allowed to read and write.
 *
 * @param id            unique capability id referenced by plan steps
 * @param name          display name
 * @param inputFacets   facets the capability may read; empty means all facets
 * @param outputFacets  facets the capability may write; other outputs are dropped
 * @param toolAllowlist tool names the capability may call
 * @param guards        post-conditions checked after every invocation
 */
public record CapabilityRegistration(
    String id,
    String name,
    Set<String> inputFacets,
    Set<String> outputFacets,
    List<String> toolAllowlist,
    List<GuardDefinition> guards
) {
    public CapabilityRegistration {
        inputFacets = inputFacets != null ? Set.copyOf(inputFacets) : Set.of();
        outputFacets = outputFacets != null ? Set.copyOf(outputFacets) : Set.of();
        toolAllowlist = toolAllowlist != null ? List.copyOf(toolAllowlist) : List.of();
        guards = guards != null ? List.copyOf(guards) : List.of();
    }
}
