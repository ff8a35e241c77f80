package com.awesomeposter.core.guard;

/**
 * A post-condition attached to a capability registration.
 *
 * @param facet     output facet the guard inspects
 * @param path      JSON pointer into the facet value ({@code ""} for the whole value)
 * @param condition compiled condition; the resolved value is bound to {@code value}
 */
public record GuardDefinition(String facet, String path, CompiledCondition condition) {

    public GuardDefinition {
        if (facet == null || facet.isBlank()) {
            throw new IllegalArgumentException("Guard facet is required");
        }
        path = path != null ? path : "";
    }

    /** The (facet, path) pair that must be unique within one registration. */
    public String key() {
        return facet + "#" + path;
    }
}
