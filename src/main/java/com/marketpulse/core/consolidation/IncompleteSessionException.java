package com.marketpulse.core.consolidation;

import com.marketpulse.core.engine.PipelineException;

import java.util.List;

/**
 * Consolidation was requested for a session missing accepted results for mandatory stages.
 */
public class IncompleteSessionException extends PipelineException {

    private final List<String> missingStages;

    public IncompleteSessionException(String sessionId, List<String> missingStages) {
        super("Session " + sessionId + " is incomplete; mandatory stages without accepted results: " + missingStages);
        this.missingStages = List.copyOf(missingStages);
    }

    public List<String> getMissingStages() {
        return missingStages;
    }
}
