package com.marketpulse.core.engine;

import com.marketpulse.core.model.Checkpoint;

import java.util.List;

/**
 * A session stopped before producing a report. Carries the checkpoints
 * recovered for the session so callers can reconstruct partial work.
 */
public abstract class PipelineAbortException extends PipelineException {

    private final String sessionId;
    private final String stage;
    private final List<Checkpoint> checkpoints;

    protected PipelineAbortException(String message, Throwable cause, String sessionId, String stage,
                                     List<Checkpoint> checkpoints) {
        super(message, cause);
        this.sessionId = sessionId;
        this.stage = stage;
        this.checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getStage() {
        return stage;
    }

    public List<Checkpoint> getCheckpoints() {
        return checkpoints;
    }
}
