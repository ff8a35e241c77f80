package com.awesomeposter.core.capability;

import com.awesomeposter.core.hitl.HitlPayload;

import java.util.Map;

/**
 * What a capability produced.
 *
 * @param outputs     facet values keyed by facet name
 * @param hitlRequest a question for a human, or null
 * @param metrics     numeric metrics the step reports (checked by onMetricBelow policies)
 */
public record CapabilityResult(
    Map<String, Object> outputs,
    HitlPayload hitlRequest,
    Map<String, Double> metrics
) {
    public CapabilityResult {
        outputs = outputs != null ? outputs : Map.of();
        metrics = metrics != null ? metrics : Map.of();
    }

    public static CapabilityResult of(Map<String, Object> outputs) {
        return new CapabilityResult(outputs, null, Map.of());
    }

    public static CapabilityResult askHuman(HitlPayload payload) {
        return new CapabilityResult(Map.of(), payload, Map.of());
    }
}
