package com.awesomeposter.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for orchestrator runs and streams.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String outcome) {
        Counter.builder("awesomeposter.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStepDuration(String capabilityId, long ms) {
        Timer.builder("awesomeposter.step.duration")
                .tag("capability", capabilityId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGuardResult(boolean passed) {
        Counter.builder("awesomeposter.guard.evaluations")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordPolicyAction(String actionType) {
        Counter.builder("awesomeposter.policy.actions")
                .tag("action", actionType)
                .register(registry)
                .increment();
    }

    /**
     * @param accepted false when the request was auto-denied because the per-run limit was reached
     */
    public void recordHitlRequest(boolean accepted) {
        Counter.builder("awesomeposter.hitl.requests")
                .tag("accepted", String.valueOf(accepted))
                .register(registry)
                .increment();
    }

    public void recordHitlDenial() {
        Counter.builder("awesomeposter.hitl.denials")
                .register(registry)
                .increment();
    }

    public void recordPlanVersion(int version) {
        DistributionSummary.builder("awesomeposter.plan.version")
                .description("Plan revision reached when a run ends")
                .register(registry)
                .record(version);
    }

    // --- Streaming ---

    public void recordAdmissionRejected() {
        Counter.builder("awesomeposter.streams.rejected")
                .description("Stream requests rejected because the backlog was full")
                .register(registry)
                .increment();
    }

    /**
     * Registers the gauge reporting open-or-queued streams. Safe to call more than once.
     */
    public void registerActiveStreams(Supplier<Number> pending) {
        Gauge.builder("awesomeposter.streams.active", pending)
                .description("Streams currently open or queued")
                .register(registry);
    }
}
