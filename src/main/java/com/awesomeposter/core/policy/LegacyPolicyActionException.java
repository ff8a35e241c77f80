package com.awesomeposter.core.policy;

/**
 * Thrown when a policy uses a retired action name. Names the action to use instead.
 */
public class LegacyPolicyActionException extends PolicyConfigurationException {

    private final String legacyAction;
    private final ActionType replacement;

    public LegacyPolicyActionException(String policyId, String legacyAction, ActionType replacement) {
        super(policyId, "Unsupported legacy action '" + legacyAction + "'; use '" + replacement.wireName() + "' instead");
        this.legacyAction = legacyAction;
        this.replacement = replacement;
    }

    public String getLegacyAction() {
        return legacyAction;
    }

    public ActionType getReplacement() {
        return replacement;
    }
}
