package com.awesomeposter.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "awesomeposter.orchestrator")
public class OrchestratorProperties {

    /** Upper bound on planner/step iterations in one run. */
    private int maxIterations = 50;

    /** HITL requests accepted per run; later ones are recorded as denied. */
    private int maxHitlRequestsPerRun = 3;

    /** End the run as failed when a step fails and no policy handles it. */
    private boolean failOnUnhandledStepFailure = true;

    /** Runtime policies applied when a request carries none and the thread has none stored. */
    private List<Map<String, Object>> defaultPolicies = new ArrayList<>();

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public int getMaxHitlRequestsPerRun() { return maxHitlRequestsPerRun; }
    public void setMaxHitlRequestsPerRun(int maxHitlRequestsPerRun) { this.maxHitlRequestsPerRun = maxHitlRequestsPerRun; }

    public boolean isFailOnUnhandledStepFailure() { return failOnUnhandledStepFailure; }
    public void setFailOnUnhandledStepFailure(boolean failOnUnhandledStepFailure) { this.failOnUnhandledStepFailure = failOnUnhandledStepFailure; }

    public List<Map<String, Object>> getDefaultPolicies() { return defaultPolicies; }
    public void setDefaultPolicies(List<Map<String, Object>> defaultPolicies) { this.defaultPolicies = defaultPolicies; }
}
