package com.marketpulse.core.engine;

import com.marketpulse.core.model.Checkpoint;

import java.util.List;

/**
 * A mandatory stage failed (or the session was cancelled) and the session was aborted.
 */
public class SessionAbortedException extends PipelineAbortException {

    public SessionAbortedException(String sessionId, String stage, String reason, Throwable cause,
                                   List<Checkpoint> checkpoints) {
        super("Session " + sessionId + " aborted at stage '" + stage + "': " + reason,
                cause, sessionId, stage, checkpoints);
    }
}
