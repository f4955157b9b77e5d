package com.marketpulse.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequence of phases preparing the audience before the offer.
 */
public record PrePitchPayload(List<Phase> phases, String transitionScript) implements StagePayload {

    public static final String OUTPUT_TYPE = "pre_pitch";

    public record Phase(String name, String objective, List<String> drivers, String script) {}

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (StagePayload.isEmpty(phases)) {
            missing.add("phases");
        }
        if (StagePayload.isEmpty(transitionScript)) {
            missing.add("transitionScript");
        }
        return missing;
    }
}
