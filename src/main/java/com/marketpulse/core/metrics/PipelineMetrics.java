package com.marketpulse.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, boolean success, long ms) {
        Timer.builder("marketpulse.stage.duration")
                .tag("stage", stage)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateResult(String stage, boolean passed) {
        Counter.builder("marketpulse.quality_gate.evaluations")
                .tag("stage", stage)
                .tag("result", passed ? "passed" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordProviderFailure(String category, String provider) {
        Counter.builder("marketpulse.provider.failures")
                .description("Failed or timed-out provider calls")
                .tag("category", category)
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * Records a provider crossing its failure threshold and entering cooldown.
     */
    public void recordProviderDisabled(String category, String provider) {
        Counter.builder("marketpulse.provider.disabled")
                .description("Providers disabled after consecutive failures")
                .tag("category", category)
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordProviderExhausted(String category) {
        Counter.builder("marketpulse.provider.exhausted")
                .description("Calls for which every provider of a category failed")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordCheckpointFailure() {
        Counter.builder("marketpulse.checkpoint.write_failures")
                .register(registry)
                .increment();
    }

    public void recordSessionResult(String status) {
        Counter.builder("marketpulse.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
