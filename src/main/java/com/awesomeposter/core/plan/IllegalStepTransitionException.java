package com.awesomeposter.core.plan;

import com.awesomeposter.core.model.StepStatus;

/**
 * Thrown when the run loop tries to move a step to a status its current status cannot reach.
 */
public class IllegalStepTransitionException extends RuntimeException {

    private final String stepId;
    private final StepStatus from;
    private final StepStatus to;

    public IllegalStepTransitionException(String stepId, StepStatus from, StepStatus to) {
        super("Step " + stepId + " cannot transition from " + from.wireName() + " to " + to.wireName());
        this.stepId = stepId;
        this.from = from;
        this.to = to;
    }

    public String getStepId() {
        return stepId;
    }

    public StepStatus getFrom() {
        return from;
    }

    public StepStatus getTo() {
        return to;
    }
}
