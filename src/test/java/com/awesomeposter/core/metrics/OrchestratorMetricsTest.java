package com.awesomeposter.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestratorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestratorMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult counts by outcome")
    void recordRunResult() {
        metrics.recordRunResult("completed");
        metrics.recordRunResult("completed");
        metrics.recordRunResult("pending_hitl");

        assertEquals(2.0, registry.find("awesomeposter.runs.total").tag("outcome", "completed").counter().count());
        assertEquals(1.0, registry.find("awesomeposter.runs.total").tag("outcome", "pending_hitl").counter().count());
    }

    @Test
    @DisplayName("recordStepDuration records a timer per capability")
    void recordStepDuration() {
        metrics.recordStepDuration("strategy", 120);
        metrics.recordStepDuration("qa", 40);
        metrics.recordStepDuration("qa", 60);

        var qa = registry.find("awesomeposter.step.duration").tag("capability", "qa").timer();
        assertNotNull(qa);
        assertEquals(2, qa.count());
        assertEquals(1, registry.find("awesomeposter.step.duration").tag("capability", "strategy").timer().count());
    }

    @Test
    @DisplayName("recordGuardResult splits passed and failed")
    void recordGuardResult() {
        metrics.recordGuardResult(true);
        metrics.recordGuardResult(false);
        metrics.recordGuardResult(false);

        assertEquals(1.0, registry.find("awesomeposter.guard.evaluations").tag("result", "passed").counter().count());
        assertEquals(2.0, registry.find("awesomeposter.guard.evaluations").tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("policy actions and HITL requests are tagged")
    void policyAndHitl() {
        metrics.recordPolicyAction("goto");
        metrics.recordHitlRequest(true);
        metrics.recordHitlRequest(false);
        metrics.recordHitlDenial();

        assertEquals(1.0, registry.find("awesomeposter.policy.actions").tag("action", "goto").counter().count());
        assertEquals(1.0, registry.find("awesomeposter.hitl.requests").tag("accepted", "false").counter().count());
        assertEquals(1.0, registry.find("awesomeposter.hitl.denials").counter().count());
    }

    @Test
    @DisplayName("recordPlanVersion feeds a distribution summary")
    void recordPlanVersion() {
        metrics.recordPlanVersion(3);
        metrics.recordPlanVersion(5);

        var summary = registry.find("awesomeposter.plan.version").summary();
        assertEquals(2, summary.count());
        assertEquals(5.0, summary.max());
    }

    @Test
    @DisplayName("stream gauge follows its supplier and rejections are counted")
    void streams() {
        AtomicInteger pending = new AtomicInteger(2);
        metrics.registerActiveStreams(pending::get);
        metrics.recordAdmissionRejected();
        pending.set(7);

        assertEquals(7.0, registry.find("awesomeposter.streams.active").gauge().value());
        assertEquals(1.0, registry.find("awesomeposter.streams.rejected").counter().count());
    }
}
