package com.marketpulse.core.model;

import java.util.List;

/**
 * Demonstrations that make abstract claims tangible.
 */
public record VisualProofsPayload(List<Proof> proofs) implements StagePayload {

    public static final String OUTPUT_TYPE = "visual_proofs";

    public record Proof(String concept, String demonstration, List<String> materials, String expectedImpact) {}

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        return StagePayload.isEmpty(proofs) ? List.of("proofs") : List.of();
    }
}
