package com.marketpulse.core.model;

import java.util.List;

/**
 * Psychological triggers tailored to the avatar.
 */
public record MentalDriversPayload(List<Driver> drivers) implements StagePayload {

    public static final String OUTPUT_TYPE = "mental_drivers";

    public record Driver(String name, String trigger, String narrative, String activationPhrase) {}

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        return StagePayload.isEmpty(drivers) ? List.of("drivers") : List.of();
    }
}
