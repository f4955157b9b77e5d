package com.marketpulse.core.stages;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ResearchPayload;
import com.marketpulse.core.model.ResearchStatistics;
import com.marketpulse.core.model.SourceDocument;
import com.marketpulse.core.model.StageOutcome;
import com.marketpulse.core.provider.AllProvidersFailedException;
import com.marketpulse.core.provider.ProviderCallResult;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import com.marketpulse.core.provider.ResearchProvider;
import com.marketpulse.core.provider.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Searches the web for the request's segment and keeps the extracted text of
 * the top results.
 * <p>
 * A query whose providers are all exhausted is skipped with a warning; the
 * stage only fails when no query could be searched at all. Pages are fetched
 * through the provider that served the search, outside the fallback selector,
 * so extraction never touches search health. Thresholds on the amount and
 * quality of content are left to the quality gate.
 */
@Component
public class ResearchStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ResearchStage.class);

    private final ProviderFallbackSelector selector;
    private final ProviderRoster<ResearchProvider> providers;
    private final ResearchQueryPlanner planner;
    private final ContentQualityScorer scorer;
    private final PipelineProperties.Research settings;

    public ResearchStage(ProviderFallbackSelector selector, ProviderRoster<ResearchProvider> providers,
                         ResearchQueryPlanner planner, ContentQualityScorer scorer, PipelineProperties properties) {
        this.selector = selector;
        this.providers = providers;
        this.planner = planner;
        this.scorer = scorer;
        this.settings = properties.getResearch();
    }

    @Override
    public String name() {
        return StageNames.RESEARCH;
    }

    @Override
    public List<String> dependencies() {
        return List.of();
    }

    @Override
    public String outputType() {
        return ResearchPayload.OUTPUT_TYPE;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        List<String> queries = planner.plan(context.request(), settings.getMaxQueries());
        List<String> warnings = new ArrayList<>();
        List<SourceDocument> documents = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        Map<ProviderCategory, String> providersUsed = new LinkedHashMap<>();
        AllProvidersFailedException lastFailure = null;
        int searched = 0;
        int totalResults = 0;

        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            log.info("Research query {}/{}: {}", i + 1, queries.size(), query);

            ProviderCallResult<List<SearchHit>> hits;
            try {
                hits = selector.call(ProviderCategory.RESEARCH, providers.providers(),
                        p -> p.search(query, settings.getResultsPerQuery()));
            } catch (AllProvidersFailedException e) {
                lastFailure = e;
                warnings.add("Query skipped, all research providers failed: " + query);
                continue;
            }
            searched++;
            totalResults += hits.value().size();
            String servingName = hits.providerName();
            providersUsed.put(ProviderCategory.RESEARCH, servingName);
            ResearchProvider serving = providers.find(servingName)
                    .orElseThrow(() -> new IllegalStateException("Unknown research provider " + servingName));

            List<SearchHit> top = hits.value().subList(0, Math.min(settings.getFetchPerQuery(), hits.value().size()));
            for (SearchHit hit : top) {
                if (!seenUrls.add(hit.url())) {
                    continue;
                }
                fetch(serving, hit, query).ifPresent(documents::add);
            }
        }

        if (searched == 0) {
            String message = "No research query could be executed (" + queries.size() + " attempted)";
            return StageOutcome.error(message, lastFailure, warnings);
        }

        var payload = new ResearchPayload(queries, documents, statistics(queries.size(), totalResults, documents),
                warnings);
        log.info("Research finished: {} source(s) from {} result(s), {} unique domain(s)",
                documents.size(), totalResults, payload.statistics().uniqueDomains());
        return StageOutcome.success(payload, providersUsed, warnings);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private Optional<SourceDocument> fetch(ResearchProvider provider, SearchHit hit, String query) {
        Optional<String> text;
        try {
            text = provider.fetch(hit.url());
        } catch (RuntimeException e) {
            log.debug("Extraction of {} via {} failed: {}", hit.url(), provider.name(), e.getMessage());
            return Optional.empty();
        }
        return text
                .filter(content -> content.length() > settings.getMinExtractedLength())
                .map(content -> new SourceDocument(hit.url(), hit.title(), content, query, provider.name(),
                        scorer.score(content)));
    }

    static ResearchStatistics statistics(int totalQueries, int totalResults, List<SourceDocument> documents) {
        long totalLength = 0;
        long totalQuality = 0;
        int qualified = 0;
        Set<String> domains = new HashSet<>();
        for (SourceDocument doc : documents) {
            totalLength += doc.contentLength();
            totalQuality += doc.qualityScore();
            if (doc.qualityScore() >= ContentQualityScorer.QUALIFIED_SCORE) {
                qualified++;
            }
            domainOf(doc.url()).ifPresent(domains::add);
        }
        long average = documents.isEmpty() ? 0 : totalLength / documents.size();
        double avgQuality = documents.isEmpty() ? 0.0
                : Math.round(totalQuality * 10.0 / documents.size()) / 10.0;
        return new ResearchStatistics(totalQueries, totalResults, documents.size(), totalLength, domains.size(),
                average, qualified, avgQuality);
    }

    static Optional<String> domainOf(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return Optional.empty();
            }
            host = host.toLowerCase(Locale.ROOT);
            return Optional.of(host.startsWith("www.") ? host.substring(4) : host);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
