package com.awesomeposter.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A change to an existing step proposed by the planner. Null fields are left untouched.
 */
public record StepUpdate(
    String id,
    StepStatus status,
    String note,
    Map<String, Object> output
) implements Serializable {
}
