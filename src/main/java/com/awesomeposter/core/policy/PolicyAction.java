package com.awesomeposter.core.policy;

import java.io.Serializable;
import java.util.Map;

/**
 * What a runtime policy does when it fires. One record per {@link ActionType}.
 */
public sealed interface PolicyAction extends Serializable {

    ActionType type();

    /** Hand control to the named step. */
    record Goto(String next) implements PolicyAction {
        public ActionType type() { return ActionType.GOTO; }
    }

    /** Ask the planner for a fresh delta. */
    record Replan(String rationale) implements PolicyAction {
        public ActionType type() { return ActionType.REPLAN; }
    }

    /** Pause for human approval even though no capability asked. */
    record Hitl(String rationale) implements PolicyAction {
        public ActionType type() { return ActionType.HITL; }
    }

    record Fail(String message) implements PolicyAction {
        public ActionType type() { return ActionType.FAIL; }
    }

    /** Store a snapshot and stop without failing. */
    record Pause(String reason) implements PolicyAction {
        public ActionType type() { return ActionType.PAUSE; }
    }

    /** Surface an event to the client; no state change. */
    record Emit(String event, Map<String, Object> payload) implements PolicyAction {
        public Emit {
            payload = payload != null ? payload : Map.of();
        }

        public ActionType type() { return ActionType.EMIT; }
    }
}
