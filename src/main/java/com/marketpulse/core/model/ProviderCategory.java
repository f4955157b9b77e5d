package com.marketpulse.core.model;

/**
 * Kind of external service a provider implements.
 */
public enum ProviderCategory {
    RESEARCH,
    AI;

    public String key() {
        return name().toLowerCase();
    }

    public static ProviderCategory fromKey(String key) {
        return valueOf(key.trim().toUpperCase());
    }
}
