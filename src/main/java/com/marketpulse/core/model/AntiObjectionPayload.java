package com.marketpulse.core.model;

import java.util.List;

/**
 * Prepared answers to the buyer's objections.
 */
public record AntiObjectionPayload(List<ObjectionResponse> responses) implements StagePayload {

    public static final String OUTPUT_TYPE = "anti_objection";

    public record ObjectionResponse(String objection, String response, String proof) {}

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        return StagePayload.isEmpty(responses) ? List.of("responses") : List.of();
    }
}
