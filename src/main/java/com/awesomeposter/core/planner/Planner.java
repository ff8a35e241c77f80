package com.awesomeposter.core.planner;

import com.awesomeposter.core.model.PlanDelta;

/**
 * Proposes plan changes. Called once per run loop iteration; an empty delta means the
 * current plan stands.
 */
public interface Planner {

    PlanDelta propose(PlannerContext context);
}
