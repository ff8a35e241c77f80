package com.awesomeposter.core.policy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads runtime policies from their JSON shape.
 * <pre>
 * { "id": "qa-retry", "enabled": true,
 *   "trigger": { "kind": "onValidationFail", "selector": { "capabilityId": "qa" } },
 *   "action":  { "type": "goto", "next": "generation" } }
 * </pre>
 * Unknown trigger kinds, unknown action types and retired action names are rejected here
 * rather than coerced at evaluation time.
 */
@Component
public class RuntimePolicyParser {

    /**
     * @throws PolicyConfigurationException for malformed policies or duplicate ids
     * @throws LegacyPolicyActionException  for retired action names
     */
    public List<RuntimePolicy> parse(List<Map<String, Object>> rawPolicies) {
        if (rawPolicies == null || rawPolicies.isEmpty()) {
            return List.of();
        }
        List<RuntimePolicy> policies = new ArrayList<>(rawPolicies.size());
        Set<String> ids = new HashSet<>();
        for (Map<String, Object> raw : rawPolicies) {
            RuntimePolicy policy = parsePolicy(raw);
            if (!ids.add(policy.id())) {
                throw new PolicyConfigurationException(policy.id(), "duplicate policy id");
            }
            policies.add(policy);
        }
        return List.copyOf(policies);
    }

    RuntimePolicy parsePolicy(Map<String, Object> raw) {
        if (raw == null) {
            throw new PolicyConfigurationException(null, "Policy entry must be an object");
        }
        String id = string(raw.get("id"));
        if (id == null) {
            throw new PolicyConfigurationException(null, "Policy id is required");
        }
        Object enabledRaw = raw.get("enabled");
        boolean enabled = true;
        if (enabledRaw instanceof Boolean b) {
            enabled = b;
        } else if (enabledRaw != null) {
            throw new PolicyConfigurationException(id, "enabled must be a boolean");
        }
        PolicyTrigger trigger = parseTrigger(id, map(id, raw.get("trigger"), "trigger"));
        PolicyAction action = parseAction(id, map(id, raw.get("action"), "action"));
        return new RuntimePolicy(id, enabled, trigger, action);
    }

    private PolicyTrigger parseTrigger(String id, Map<String, Object> raw) {
        String kindName = string(raw.get("kind"));
        TriggerKind kind = TriggerKind.fromWire(kindName);
        if (kind == null) {
            throw new PolicyConfigurationException(id, "Unknown trigger kind '" + kindName + "'");
        }
        return switch (kind) {
            case ON_START -> new PolicyTrigger.OnStart();
            case ON_NODE_COMPLETE -> new PolicyTrigger.OnNodeComplete(selector(id, raw));
            case ON_VALIDATION_FAIL -> new PolicyTrigger.OnValidationFail(selector(id, raw));
            case ON_TIMEOUT -> {
                Number ms = number(raw.get("ms"));
                if (ms == null || ms.longValue() <= 0) {
                    throw new PolicyConfigurationException(id, "onTimeout requires a positive 'ms'");
                }
                yield new PolicyTrigger.OnTimeout(ms.longValue(), selector(id, raw));
            }
            case ON_METRIC_BELOW -> {
                String metric = string(raw.get("metric"));
                Number threshold = number(raw.get("threshold"));
                if (metric == null || threshold == null) {
                    throw new PolicyConfigurationException(id, "onMetricBelow requires 'metric' and numeric 'threshold'");
                }
                yield new PolicyTrigger.OnMetricBelow(metric, threshold.doubleValue(), selector(id, raw));
            }
            case MANUAL -> new PolicyTrigger.Manual();
        };
    }

    private PolicyAction parseAction(String id, Map<String, Object> raw) {
        String typeName = string(raw.get("type"));
        if (typeName == null) {
            throw new PolicyConfigurationException(id, "Action type is required");
        }
        ActionType legacy = ActionType.LEGACY_ALIASES.get(typeName);
        if (legacy != null) {
            throw new LegacyPolicyActionException(id, typeName, legacy);
        }
        ActionType type = ActionType.fromWire(typeName);
        if (type == null) {
            throw new PolicyConfigurationException(id, "Unsupported action type '" + typeName + "'");
        }
        return switch (type) {
            case GOTO -> {
                String next = string(raw.get("next"));
                if (next == null) {
                    throw new PolicyConfigurationException(id, "goto requires 'next'");
                }
                yield new PolicyAction.Goto(next);
            }
            case REPLAN -> new PolicyAction.Replan(string(raw.get("rationale")));
            case HITL -> new PolicyAction.Hitl(string(raw.get("rationale")));
            case FAIL -> {
                String message = string(raw.get("message"));
                yield new PolicyAction.Fail(message != null ? message : "Run failed by policy " + id);
            }
            case PAUSE -> new PolicyAction.Pause(string(raw.get("reason")));
            case EMIT -> {
                String event = string(raw.get("event"));
                if (event == null) {
                    throw new PolicyConfigurationException(id, "emit requires 'event'");
                }
                Object payload = raw.get("payload");
                if (payload != null && !(payload instanceof Map)) {
                    throw new PolicyConfigurationException(id, "emit payload must be an object");
                }
                yield new PolicyAction.Emit(event, payload != null ? map(id, payload, "payload") : Map.of());
            }
        };
    }

    private NodeSelector selector(String id, Map<String, Object> trigger) {
        Object raw = trigger.get("selector");
        if (raw == null) {
            return NodeSelector.ANY;
        }
        Map<String, Object> selector = map(id, raw, "selector");
        return new NodeSelector(string(selector.get("nodeId")), string(selector.get("capabilityId")));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(String id, Object value, String field) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new PolicyConfigurationException(id, "'" + field + "' must be an object");
    }

    private static String string(Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return s.trim();
        }
        return null;
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
