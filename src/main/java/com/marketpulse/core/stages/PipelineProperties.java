package com.marketpulse.core.stages;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline layout bound from {@code marketpulse.pipeline.*}.
 * <p>
 * Whether a stage is required is decided here, per stage, and never inferred
 * from the stage's identity.
 */
@Component
@ConfigurationProperties(prefix = "marketpulse.pipeline")
public class PipelineProperties {

    /** Stage names in execution order. */
    private List<String> order = new ArrayList<>(List.of(
            StageNames.RESEARCH,
            StageNames.SYNTHESIS,
            StageNames.MENTAL_DRIVERS,
            StageNames.VISUAL_PROOFS,
            StageNames.ANTI_OBJECTION,
            StageNames.PRE_PITCH,
            StageNames.FUTURE_PREDICTIONS));

    private Map<String, StageSettings> stages = new HashMap<>(Map.of(
            StageNames.RESEARCH, new StageSettings(true, 2),
            StageNames.SYNTHESIS, new StageSettings(true, 2),
            StageNames.FUTURE_PREDICTIONS, new StageSettings(false, 1)));

    private Research research = new Research();
    private Ai ai = new Ai();

    public List<String> getOrder() { return order; }
    public void setOrder(List<String> order) { this.order = order; }

    public Map<String, StageSettings> getStages() { return stages; }
    public void setStages(Map<String, StageSettings> stages) { this.stages = stages; }

    public Research getResearch() { return research; }
    public void setResearch(Research research) { this.research = research; }

    public Ai getAi() { return ai; }
    public void setAi(Ai ai) { this.ai = ai; }

    /** Settings for a stage; stages without an entry are required, enabled and weighted 1. */
    public StageSettings settingsFor(String stage) {
        StageSettings settings = stages.get(stage);
        return settings != null ? settings : new StageSettings();
    }

    public static class StageSettings {
        private boolean required = true;
        private boolean enabled = true;
        private int weight = 1;

        public StageSettings() {}

        public StageSettings(boolean required, int weight) {
            this.required = required;
            this.weight = weight;
        }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }
    }

    public static class Research {
        private int maxQueries = 15;
        private int resultsPerQuery = 12;
        private int fetchPerQuery = 8;
        /** Extracted text must be longer than this to be kept. */
        private int minExtractedLength = 500;

        public int getMaxQueries() { return maxQueries; }
        public void setMaxQueries(int maxQueries) { this.maxQueries = maxQueries; }

        public int getResultsPerQuery() { return resultsPerQuery; }
        public void setResultsPerQuery(int resultsPerQuery) { this.resultsPerQuery = resultsPerQuery; }

        public int getFetchPerQuery() { return fetchPerQuery; }
        public void setFetchPerQuery(int fetchPerQuery) { this.fetchPerQuery = fetchPerQuery; }

        public int getMinExtractedLength() { return minExtractedLength; }
        public void setMinExtractedLength(int minExtractedLength) { this.minExtractedLength = minExtractedLength; }
    }

    public static class Ai {
        private int maxTokens = 8192;
        /** Characters of each source document included in the synthesis prompt. */
        private int excerptLength = 1500;
        private int maxExcerpts = 20;

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getExcerptLength() { return excerptLength; }
        public void setExcerptLength(int excerptLength) { this.excerptLength = excerptLength; }

        public int getMaxExcerpts() { return maxExcerpts; }
        public void setMaxExcerpts(int maxExcerpts) { this.maxExcerpts = maxExcerpts; }
    }
}
