package com.marketpulse.core.engine;

/**
 * Root of all pipeline failures surfaced to callers.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
