package com.awesomeposter.core.policy;

import java.io.Serializable;

/**
 * When a runtime policy fires. One record per {@link TriggerKind}.
 */
public sealed interface PolicyTrigger extends Serializable {

    TriggerKind kind();

    record OnStart() implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.ON_START; }
    }

    record OnNodeComplete(NodeSelector selector) implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.ON_NODE_COMPLETE; }
    }

    record OnValidationFail(NodeSelector selector) implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.ON_VALIDATION_FAIL; }
    }

    /** Fires when a step took at least {@code ms} milliseconds. */
    record OnTimeout(long ms, NodeSelector selector) implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.ON_TIMEOUT; }
    }

    /** Fires when a step reports {@code metric} strictly below {@code threshold}. */
    record OnMetricBelow(String metric, double threshold, NodeSelector selector) implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.ON_METRIC_BELOW; }
    }

    record Manual() implements PolicyTrigger {
        public TriggerKind kind() { return TriggerKind.MANUAL; }
    }
}
