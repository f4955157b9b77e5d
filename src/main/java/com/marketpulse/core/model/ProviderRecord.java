package com.marketpulse.core.model;

import java.time.Instant;

/**
 * Point-in-time view of one provider's health.
 *
 * @param name                provider name
 * @param category            provider category
 * @param consecutiveFailures failures since the last success or reset
 * @param disabledUntil       end of the cooldown, or null when not disabled
 * @param lastError           last recorded error message, or null
 * @param available           whether the provider is selectable at snapshot time
 */
public record ProviderRecord(
        String name,
        ProviderCategory category,
        int consecutiveFailures,
        Instant disabledUntil,
        String lastError,
        boolean available
) {}
