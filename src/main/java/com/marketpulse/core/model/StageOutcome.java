package com.marketpulse.core.model;

import java.util.List;
import java.util.Map;

/**
 * Typed return value of a stage work function. Expected failures (exhausted
 * providers, unusable responses) come back as {@link Kind#ERROR} instead of
 * being thrown.
 */
public record StageOutcome(
        Kind kind,
        StagePayload payload,
        Map<ProviderCategory, String> providersUsed,
        String message,
        Throwable cause,
        List<String> warnings
) {
    public enum Kind { SUCCESS, ERROR }

    public StageOutcome {
        providersUsed = providersUsed == null ? Map.of() : Map.copyOf(providersUsed);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static StageOutcome success(StagePayload payload, Map<ProviderCategory, String> providersUsed) {
        return new StageOutcome(Kind.SUCCESS, payload, providersUsed, null, null, List.of());
    }

    public static StageOutcome success(StagePayload payload, Map<ProviderCategory, String> providersUsed,
                                       List<String> warnings) {
        return new StageOutcome(Kind.SUCCESS, payload, providersUsed, null, null, warnings);
    }

    public static StageOutcome error(String message, Throwable cause) {
        return new StageOutcome(Kind.ERROR, null, Map.of(), message, cause, List.of());
    }

    public static StageOutcome error(String message, Throwable cause, List<String> warnings) {
        return new StageOutcome(Kind.ERROR, null, Map.of(), message, cause, warnings);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
