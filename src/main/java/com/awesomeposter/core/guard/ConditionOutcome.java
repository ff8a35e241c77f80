package com.awesomeposter.core.guard;

/**
 * Result of evaluating one condition: satisfied or not, or an error explaining why it
 * could not be evaluated.
 */
public record ConditionOutcome(boolean satisfied, String error) {

    public static ConditionOutcome of(boolean satisfied) {
        return new ConditionOutcome(satisfied, null);
    }

    public static ConditionOutcome error(String error) {
        return new ConditionOutcome(false, error);
    }

    public boolean isError() {
        return error != null;
    }
}
