package com.marketpulse.core.stages;

import com.marketpulse.core.engine.PipelineException;

/**
 * A stage failed for a reason other than provider exhaustion.
 */
public class StageExecutionException extends PipelineException {

    private final String stage;

    public StageExecutionException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageExecutionException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
