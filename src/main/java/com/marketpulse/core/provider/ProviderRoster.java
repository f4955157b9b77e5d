package com.marketpulse.core.provider;

import com.marketpulse.core.model.ProviderCategory;

import java.util.List;
import java.util.Optional;

/**
 * Providers of one category in priority order.
 */
public record ProviderRoster<P extends NamedProvider>(ProviderCategory category, List<P> providers) {

    public ProviderRoster {
        providers = List.copyOf(providers);
    }

    public Optional<P> find(String name) {
        return providers.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public List<String> names() {
        return providers.stream().map(NamedProvider::name).toList();
    }
}
