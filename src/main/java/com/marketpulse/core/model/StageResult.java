package com.marketpulse.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable outcome of one stage execution, owned by its {@code AnalysisSession}.
 *
 * @param stageName     the stage that produced this result
 * @param success       whether the stage produced a payload
 * @param payload       the stage output (null when {@code success} is false)
 * @param error         failure detail (null on success)
 * @param timestamp     when the stage finished
 * @param providersUsed provider that served the stage, per category
 * @param durationMs    wall time spent in the stage
 */
public record StageResult(
        String stageName,
        boolean success,
        StagePayload payload,
        String error,
        Instant timestamp,
        Map<ProviderCategory, String> providersUsed,
        long durationMs
) {
    public StageResult {
        providersUsed = providersUsed == null ? Map.of() : Map.copyOf(providersUsed);
    }

    public static StageResult succeeded(String stageName, StagePayload payload, Instant timestamp,
                                        Map<ProviderCategory, String> providersUsed, long durationMs) {
        return new StageResult(stageName, true, payload, null, timestamp, providersUsed, durationMs);
    }

    public static StageResult failed(String stageName, String error, Instant timestamp,
                                     Map<ProviderCategory, String> providersUsed, long durationMs) {
        return new StageResult(stageName, false, null, error, timestamp, providersUsed, durationMs);
    }
}
