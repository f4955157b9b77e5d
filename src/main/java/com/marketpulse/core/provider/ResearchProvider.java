package com.marketpulse.core.provider;

import java.util.List;
import java.util.Optional;

/**
 * Web search and page extraction backend.
 */
public interface ResearchProvider extends NamedProvider {

    /**
     * Runs a web search.
     *
     * @return results in ranking order, at most {@code maxResults}
     * @throws RuntimeException when the search service fails
     */
    List<SearchHit> search(String query, int maxResults);

    /**
     * Extracts the readable text of a page. An empty result means the page had no
     * usable content; it is not a provider failure.
     *
     * @throws RuntimeException when the provider itself fails
     */
    Optional<String> fetch(String url);
}
