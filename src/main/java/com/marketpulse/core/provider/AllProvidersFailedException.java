package com.marketpulse.core.provider;

import com.marketpulse.core.engine.PipelineException;
import com.marketpulse.core.model.ProviderAttempt;
import com.marketpulse.core.model.ProviderCategory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider of a category failed or was disabled for one call.
 */
public class AllProvidersFailedException extends PipelineException {

    private final ProviderCategory category;
    private final List<ProviderAttempt> attempts;

    public AllProvidersFailedException(ProviderCategory category, List<ProviderAttempt> attempts) {
        super("All " + category.key() + " providers failed: " + describe(attempts));
        this.category = category;
        this.attempts = List.copyOf(attempts);
    }

    public ProviderCategory getCategory() {
        return category;
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    private static String describe(List<ProviderAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "no providers configured";
        }
        return attempts.stream()
                .map(a -> a.provider() + " (" + a.error() + ")")
                .collect(Collectors.joining(", "));
    }
}
