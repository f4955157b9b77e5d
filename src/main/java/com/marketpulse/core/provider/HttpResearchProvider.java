package com.marketpulse.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ResearchProvider} backed by a JSON web search API queried with GET.
 * <p>
 * The location of the results array and the field names inside each result are
 * configurable, so the same class serves Brave, Serper-style and self-hosted
 * search endpoints. Page text is extracted locally with jsoup.
 */
public class HttpResearchProvider implements ResearchProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpResearchProvider.class);

    private final ProviderProperties.Research config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PageTextExtractor extractor;

    public HttpResearchProvider(ProviderProperties.Research config, HttpClient httpClient,
                                ObjectMapper objectMapper, PageTextExtractor extractor) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        String uri = config.getSearchUrl()
                + (config.getSearchUrl().contains("?") ? "&" : "?")
                + config.getQueryParam() + "=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&" + config.getCountParam() + "=" + maxResults;

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(uri))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .GET();
        if (config.requiresApiKey() && config.hasApiKey()) {
            builder.header(config.getKeyHeader(), config.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException("Search request to " + name() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Search request to " + name() + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("Search API " + name() + " returned HTTP " + response.statusCode());
        }
        List<SearchHit> hits = parseHits(response.body(), maxResults);
        log.debug("{} returned {} result(s) for '{}'", name(), hits.size(), query);
        return hits;
    }

    @Override
    public Optional<String> fetch(String url) {
        try {
            String text = extractor.fetchText(url, config.getFetchTimeout());
            return text.isBlank() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            log.debug("Could not extract {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    List<SearchHit> parseHits(String body, int maxResults) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("Search API " + name() + " returned malformed JSON", e);
        }

        JsonNode results = root;
        for (String segment : config.getResultsPath().split("\\.")) {
            results = results.path(segment);
        }
        if (!results.isArray()) {
            throw new IllegalStateException("Search API " + name() + " response has no '"
                    + config.getResultsPath() + "' array");
        }

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : results) {
            String url = item.path(config.getUrlField()).asText("");
            if (url.isBlank()) {
                continue;
            }
            hits.add(new SearchHit(url,
                    item.path(config.getTitleField()).asText(""),
                    item.path(config.getSnippetField()).asText("")));
            if (hits.size() >= maxResults) {
                break;
            }
        }
        return hits;
    }
}
