package com.awesomeposter.core.policy;

import java.io.Serializable;

/**
 * A trigger/action rule evaluated after each step transition.
 */
public record RuntimePolicy(
    String id,
    boolean enabled,
    PolicyTrigger trigger,
    PolicyAction action
) implements Serializable {
}
