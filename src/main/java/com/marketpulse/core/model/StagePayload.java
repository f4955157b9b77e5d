package com.marketpulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed output of a pipeline stage. One implementation per declared output type.
 */
public interface StagePayload {

    /** Output type tag, also used as the checkpoint category. */
    @JsonIgnore
    String outputType();

    /**
     * Names of required fields that are missing or empty. An empty list
     * means the payload has the expected shape.
     */
    @JsonIgnore
    List<String> missingFields();

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence cs) {
            return cs.toString().isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }
}
