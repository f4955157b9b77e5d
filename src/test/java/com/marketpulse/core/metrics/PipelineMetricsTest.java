package com.marketpulse.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void stageDurationTaggedBySuccess() {
        metrics.recordStageDuration("research", true, 1500);
        metrics.recordStageDuration("research", false, 10);

        var timer = registry.find("marketpulse.stage.duration").tags("stage", "research", "success", "true").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void gateResults() {
        metrics.recordGateResult("synthesis", true);
        metrics.recordGateResult("synthesis", false);
        metrics.recordGateResult("synthesis", false);

        assertEquals(2.0, registry.find("marketpulse.quality_gate.evaluations")
                .tags("stage", "synthesis", "result", "rejected").counter().count());
    }

    @Test
    void providerCounters() {
        metrics.recordProviderFailure("ai", "gemini");
        metrics.recordProviderFailure("ai", "gemini");
        metrics.recordProviderDisabled("ai", "gemini");
        metrics.recordProviderExhausted("research");

        assertEquals(2.0, registry.find("marketpulse.provider.failures").tag("provider", "gemini").counter().count());
        assertEquals(1.0, registry.find("marketpulse.provider.disabled").tag("category", "ai").counter().count());
        assertEquals(1.0, registry.find("marketpulse.provider.exhausted").tag("category", "research").counter().count());
    }

    @Test
    void sessionsAndCheckpoints() {
        metrics.recordSessionResult("completed");
        metrics.recordCheckpointFailure();

        assertEquals(1.0, registry.find("marketpulse.sessions.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("marketpulse.checkpoint.write_failures").counter().count());
    }
}
