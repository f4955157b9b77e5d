package com.marketpulse.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderConfigTest {

    private static ProviderProperties.Research research(String name, String url, String keyHeader, String apiKey) {
        var entry = new ProviderProperties.Research();
        entry.setName(name);
        entry.setSearchUrl(url);
        entry.setKeyHeader(keyHeader);
        entry.setApiKey(apiKey);
        return entry;
    }

    @Test
    @DisplayName("research entries without a URL, or naming a key header without a key, are left out")
    void researchRosterFiltering() {
        var properties = new ProviderProperties();
        properties.setResearch(List.of(
                research("brave", "https://api.search.brave.com/res/v1/web/search", "X-Subscription-Token", ""),
                research("serper", "https://serper.example/search", "X-API-KEY", "secret"),
                research("searxng", "http://localhost:8888/search", null, ""),
                research("ghost", " ", null, "")));
        var registry = new ProviderHealthRegistry(3, Duration.ofMinutes(5), Clock.systemUTC());

        var roster = new ProviderConfig().researchProviders(properties, registry, new ObjectMapper(),
                new PageTextExtractor());

        assertEquals(List.of("serper", "searxng"), roster.names());
        assertEquals(List.of("serper", "searxng"),
                registry.snapshot().stream().map(ProviderRecord::name).toList());
        assertTrue(registry.find(ProviderCategory.RESEARCH, "brave").isEmpty());
    }

    @Test
    void keyRequirementFollowsHeader() {
        assertTrue(research("brave", "u", "X-Subscription-Token", "").requiresApiKey());
        assertFalse(research("searxng", "u", null, "").requiresApiKey());
        assertFalse(research("searxng", "u", "  ", "k").requiresApiKey());
    }
}
