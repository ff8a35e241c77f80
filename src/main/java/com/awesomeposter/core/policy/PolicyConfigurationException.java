package com.awesomeposter.core.policy;

/**
 * Thrown when runtime policies are malformed. Raised at load time, before a run starts.
 */
public class PolicyConfigurationException extends RuntimeException {

    private final String policyId;

    public PolicyConfigurationException(String policyId, String message) {
        super(policyId != null ? "Policy '" + policyId + "': " + message : message);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
