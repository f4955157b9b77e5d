package com.marketpulse.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the research stage. The extracted documents are raw content.
 */
public record ResearchPayload(
        List<String> queries,
        @RawContent List<SourceDocument> sources,
        ResearchStatistics statistics,
        List<String> warnings
) implements StagePayload {

    public static final String OUTPUT_TYPE = "research_data";

    public ResearchPayload {
        queries = queries == null ? List.of() : List.copyOf(queries);
        sources = sources == null ? List.of() : List.copyOf(sources);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (queries.isEmpty()) {
            missing.add("queries");
        }
        if (statistics == null) {
            missing.add("statistics");
        }
        return missing;
    }
}
