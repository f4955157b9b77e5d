package com.marketpulse.core.model;

/**
 * One provider tried (or skipped) during a fallback call.
 */
public record ProviderAttempt(String provider, String error, boolean skipped) {

    public static ProviderAttempt failed(String provider, String error) {
        return new ProviderAttempt(provider, error, false);
    }

    public static ProviderAttempt skipped(String provider) {
        return new ProviderAttempt(provider, "disabled", true);
    }
}
