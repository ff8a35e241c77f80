package com.awesomeposter.core.policy;

import java.util.Map;

/**
 * A step or run transition the policy evaluator matches triggers against.
 *
 * @param stage        which transition happened
 * @param nodeId       step id (null for run-level stages)
 * @param capabilityId capability of the step (null for run-level stages and control steps)
 * @param elapsedMs    time the step spent running, when known
 * @param metrics      numeric metrics reported by the step
 */
public record LifecycleEvent(
    Stage stage,
    String nodeId,
    String capabilityId,
    Long elapsedMs,
    Map<String, Double> metrics
) {

    public enum Stage { RUN_STARTED, NODE_COMPLETED, NODE_FAILED, VALIDATION_FAILED, MANUAL }

    public LifecycleEvent {
        metrics = metrics != null ? metrics : Map.of();
    }

    public static LifecycleEvent runStarted() {
        return new LifecycleEvent(Stage.RUN_STARTED, null, null, null, Map.of());
    }

    public static LifecycleEvent manual(String nodeId) {
        return new LifecycleEvent(Stage.MANUAL, nodeId, null, null, Map.of());
    }

    public boolean isStepTransition() {
        return stage == Stage.NODE_COMPLETED || stage == Stage.NODE_FAILED || stage == Stage.VALIDATION_FAILED;
    }

    public boolean isFailure() {
        return stage == Stage.NODE_FAILED || stage == Stage.VALIDATION_FAILED;
    }
}
