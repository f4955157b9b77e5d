package com.marketpulse.core.stages;

import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.StagePayload;

import java.util.Map;

/**
 * Input handed to a stage: the request plus the payloads of its declared dependencies.
 */
public record StageContext(String sessionId, AnalysisRequest request, Map<String, StagePayload> inputs) {

    public StageContext {
        inputs = Map.copyOf(inputs);
    }

    /**
     * Payload produced by a dependency.
     *
     * @throws IllegalStateException when the dependency was not declared or has another type
     */
    public <T extends StagePayload> T input(String stage, Class<T> type) {
        StagePayload payload = inputs.get(stage);
        if (payload == null) {
            throw new IllegalStateException("No input from stage '" + stage + "'");
        }
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Input from stage '" + stage + "' is " + payload.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }
}
