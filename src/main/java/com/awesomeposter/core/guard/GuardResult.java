package com.awesomeposter.core.guard;

import java.io.Serializable;

/**
 * Evaluated guard, keyed by the same (facet, path) pair as its definition.
 */
public record GuardResult(
    String facet,
    String path,
    String expression,
    boolean satisfied,
    String error
) implements Serializable {

    public boolean passed() {
        return satisfied && error == null;
    }
}
