package com.marketpulse.core.model;

import java.util.List;

/**
 * Forecast of how the segment is likely to evolve.
 */
public record FuturePredictionsPayload(
        int horizonMonths,
        List<Scenario> scenarios,
        List<String> emergingTrends
) implements StagePayload {

    public static final String OUTPUT_TYPE = "future_predictions";

    public record Scenario(String name, double probability, String description, List<String> signals) {}

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        return StagePayload.isEmpty(scenarios) ? List.of("scenarios") : List.of();
    }
}
