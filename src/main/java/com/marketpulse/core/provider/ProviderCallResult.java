package com.marketpulse.core.provider;

import com.marketpulse.core.model.ProviderAttempt;

import java.util.List;

/**
 * Successful fallback call.
 *
 * @param providerName provider that produced the value
 * @param value        the result
 * @param attempts     providers that failed or were skipped before it, in order
 */
public record ProviderCallResult<T>(String providerName, T value, List<ProviderAttempt> attempts) {

    public ProviderCallResult {
        attempts = List.copyOf(attempts);
    }
}
