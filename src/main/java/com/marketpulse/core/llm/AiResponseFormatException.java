package com.marketpulse.core.llm;

import com.marketpulse.core.engine.PipelineException;

/**
 * Thrown when an AI response does not follow the expected JSON grammar
 * or does not bind to the target payload type.
 */
public class AiResponseFormatException extends PipelineException {

    public AiResponseFormatException(String message) {
        super(message);
    }

    public AiResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
