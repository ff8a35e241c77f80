package com.awesomeposter.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the policy that reacts to a lifecycle event.
 * <p>
 * Enabled policies are checked in declaration order and the first whose trigger matches
 * wins; later policies are not consulted for the same event.
 */
@Component
public class RuntimePolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuntimePolicyEvaluator.class);

    public Optional<RuntimePolicy> evaluate(List<RuntimePolicy> policies, LifecycleEvent event) {
        for (RuntimePolicy policy : policies) {
            if (policy.enabled() && matches(policy.trigger(), event)) {
                log.info("Policy {} matched {} on {}: {}", policy.id(), event.stage(),
                        event.nodeId() != null ? event.nodeId() : "run", policy.action().type().wireName());
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }

    boolean matches(PolicyTrigger trigger, LifecycleEvent event) {
        return switch (trigger.kind()) {
            case ON_START -> event.stage() == LifecycleEvent.Stage.RUN_STARTED;
            case ON_NODE_COMPLETE -> event.stage() == LifecycleEvent.Stage.NODE_COMPLETED
                    && selects(((PolicyTrigger.OnNodeComplete) trigger).selector(), event);
            case ON_VALIDATION_FAIL -> event.isFailure()
                    && selects(((PolicyTrigger.OnValidationFail) trigger).selector(), event);
            case ON_TIMEOUT -> {
                var timeout = (PolicyTrigger.OnTimeout) trigger;
                yield event.isStepTransition()
                        && event.elapsedMs() != null
                        && event.elapsedMs() >= timeout.ms()
                        && selects(timeout.selector(), event);
            }
            case ON_METRIC_BELOW -> {
                var below = (PolicyTrigger.OnMetricBelow) trigger;
                Map<String, Double> metrics = event.metrics();
                Double value = metrics.get(below.metric());
                yield event.isStepTransition()
                        && value != null
                        && value < below.threshold()
                        && selects(below.selector(), event);
            }
            case MANUAL -> event.stage() == LifecycleEvent.Stage.MANUAL;
        };
    }

    private static boolean selects(NodeSelector selector, LifecycleEvent event) {
        return selector == null || selector.matches(event.nodeId(), event.capabilityId());
    }
}
