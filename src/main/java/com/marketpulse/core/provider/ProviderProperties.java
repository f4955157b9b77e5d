package com.marketpulse.core.provider;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider configuration bound from {@code marketpulse.providers.*}.
 * <p>
 * The order of {@code ai} and {@code research} entries is the fallback priority.
 */
@Component
@ConfigurationProperties(prefix = "marketpulse.providers")
public class ProviderProperties {

    /** Consecutive failures that disable a provider. */
    private int failureThreshold = 3;

    /** How long a disabled provider is skipped. */
    private Duration cooldown = Duration.ofMinutes(5);

    /** Maximum time a single provider call may take before it counts as failed. */
    private Duration callTimeout = Duration.ofSeconds(60);

    private List<Ai> ai = new ArrayList<>();
    private List<Research> research = new ArrayList<>();

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

    public Duration getCooldown() { return cooldown; }
    public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }

    public List<Ai> getAi() { return ai; }
    public void setAi(List<Ai> ai) { this.ai = ai; }

    public List<Research> getResearch() { return research; }
    public void setResearch(List<Research> research) { this.research = research; }

    /**
     * An OpenAI-compatible chat completions endpoint (OpenAI, Gemini, Groq, ...).
     */
    public static class Ai {
        private String name;
        private String baseUrl;
        private String completionsPath = "/v1/chat/completions";
        private String apiKey = "";
        private String model;
        private double temperature = 0.7;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getCompletionsPath() { return completionsPath; }
        public void setCompletionsPath(String completionsPath) { this.completionsPath = completionsPath; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /**
     * A JSON web search endpoint queried with GET.
     */
    public static class Research {
        private String name;
        private String searchUrl;
        private String apiKey = "";
        /** Header carrying the API key; unset for endpoints that need no key. */
        private String keyHeader;
        private String queryParam = "q";
        private String countParam = "count";
        /** Dotted path to the results array in the response body. */
        private String resultsPath = "results";
        private String urlField = "url";
        private String titleField = "title";
        private String snippetField = "description";
        private Duration fetchTimeout = Duration.ofSeconds(15);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getSearchUrl() { return searchUrl; }
        public void setSearchUrl(String searchUrl) { this.searchUrl = searchUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getKeyHeader() { return keyHeader; }
        public void setKeyHeader(String keyHeader) { this.keyHeader = keyHeader; }

        public String getQueryParam() { return queryParam; }
        public void setQueryParam(String queryParam) { this.queryParam = queryParam; }

        public String getCountParam() { return countParam; }
        public void setCountParam(String countParam) { this.countParam = countParam; }

        public String getResultsPath() { return resultsPath; }
        public void setResultsPath(String resultsPath) { this.resultsPath = resultsPath; }

        public String getUrlField() { return urlField; }
        public void setUrlField(String urlField) { this.urlField = urlField; }

        public String getTitleField() { return titleField; }
        public void setTitleField(String titleField) { this.titleField = titleField; }

        public String getSnippetField() { return snippetField; }
        public void setSnippetField(String snippetField) { this.snippetField = snippetField; }

        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public boolean requiresApiKey() {
            return keyHeader != null && !keyHeader.isBlank();
        }
    }
}
