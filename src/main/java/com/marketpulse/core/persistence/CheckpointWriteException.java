package com.marketpulse.core.persistence;

import com.marketpulse.core.engine.PipelineException;

/**
 * A checkpoint could not be serialized or stored.
 */
public class CheckpointWriteException extends PipelineException {

    public CheckpointWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
