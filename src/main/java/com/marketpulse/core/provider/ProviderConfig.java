package com.marketpulse.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.core.model.ProviderCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ranked provider rosters from {@link ProviderProperties}.
 * <p>
 * Entries without an API key are left out of the roster. Research endpoints
 * are kept without a key only when they name no key header. Every rostered provider is registered with the
 * {@link ProviderHealthRegistry} so it is listed before its first call.
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    public ProviderRoster<AiProvider> aiProviders(ProviderProperties properties, ProviderHealthRegistry registry) {
        List<AiProvider> providers = new ArrayList<>();
        for (ProviderProperties.Ai entry : properties.getAi()) {
            if (!entry.hasApiKey()) {
                log.warn("AI provider '{}' has no API key configured; skipping", entry.getName());
                continue;
            }
            providers.add(new ChatClientAiProvider(entry.getName(), ChatClient.create(chatModel(entry))));
        }
        return register(new ProviderRoster<>(ProviderCategory.AI, providers), registry);
    }

    @Bean
    public ProviderRoster<ResearchProvider> researchProviders(ProviderProperties properties,
                                                              ProviderHealthRegistry registry,
                                                              ObjectMapper objectMapper,
                                                              PageTextExtractor extractor) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        List<ResearchProvider> providers = new ArrayList<>();
        for (ProviderProperties.Research entry : properties.getResearch()) {
            if (entry.getSearchUrl() == null || entry.getSearchUrl().isBlank()) {
                log.warn("Research provider '{}' has no search URL configured; skipping", entry.getName());
                continue;
            }
            if (entry.requiresApiKey() && !entry.hasApiKey()) {
                log.warn("Research provider '{}' expects an API key in {} but none is configured; skipping",
                        entry.getName(), entry.getKeyHeader());
                continue;
            }
            providers.add(new HttpResearchProvider(entry, httpClient, objectMapper, extractor));
        }
        return register(new ProviderRoster<>(ProviderCategory.RESEARCH, providers), registry);
    }

    private static OpenAiChatModel chatModel(ProviderProperties.Ai entry) {
        var api = OpenAiApi.builder()
                .baseUrl(entry.getBaseUrl())
                .completionsPath(entry.getCompletionsPath())
                .apiKey(entry.getApiKey())
                .build();
        // Fallback across providers replaces client-side retries.
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(entry.getModel())
                        .temperature(entry.getTemperature())
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }

    private static <P extends NamedProvider> ProviderRoster<P> register(ProviderRoster<P> roster,
                                                                       ProviderHealthRegistry registry) {
        roster.providers().forEach(p -> registry.register(roster.category(), p.name()));
        log.info("{} providers in priority order: {}", roster.category().key(), roster.names());
        return roster;
    }
}
