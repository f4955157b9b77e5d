package com.marketpulse.core.engine;

import java.util.List;

/**
 * Thrown when a request is rejected before any stage runs.
 */
public class InputValidationException extends PipelineException {

    private final List<String> errors;

    public InputValidationException(List<String> errors) {
        super("Invalid analysis request: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public InputValidationException(List<String> errors, Throwable cause) {
        super("Invalid analysis request: " + String.join("; ", errors), cause);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
