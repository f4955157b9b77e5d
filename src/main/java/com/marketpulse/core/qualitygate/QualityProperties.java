package com.marketpulse.core.qualitygate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality gate thresholds bound from {@code marketpulse.quality.*}.
 */
@Component
@ConfigurationProperties(prefix = "marketpulse.quality")
public class QualityProperties {

    /** Minimum gate score for every stage unless overridden in {@code stage-minimum-scores}. */
    private int minimumScore = 75;
    private Map<String, Integer> stageMinimumScores = new HashMap<>();

    private Research research = new Research();
    private Synthesis synthesis = new Synthesis();
    private Derived derived = new Derived();
    private List<Phrase> forbiddenPhrases = new ArrayList<>(defaultPhrases());

    public int getMinimumScore() { return minimumScore; }
    public void setMinimumScore(int minimumScore) { this.minimumScore = minimumScore; }

    public Map<String, Integer> getStageMinimumScores() { return stageMinimumScores; }
    public void setStageMinimumScores(Map<String, Integer> stageMinimumScores) { this.stageMinimumScores = stageMinimumScores; }

    public Research getResearch() { return research; }
    public void setResearch(Research research) { this.research = research; }

    public Synthesis getSynthesis() { return synthesis; }
    public void setSynthesis(Synthesis synthesis) { this.synthesis = synthesis; }

    public Derived getDerived() { return derived; }
    public void setDerived(Derived derived) { this.derived = derived; }

    public List<Phrase> getForbiddenPhrases() { return forbiddenPhrases; }
    public void setForbiddenPhrases(List<Phrase> forbiddenPhrases) { this.forbiddenPhrases = forbiddenPhrases; }

    public int minimumScoreFor(String stage) {
        return stageMinimumScores.getOrDefault(stage, minimumScore);
    }

    private static List<Phrase> defaultPhrases() {
        return List.of(
                new Phrase("dados não disponíveis", ForbiddenPhrase.Severity.HIGH),
                new Phrase("informação não encontrada", ForbiddenPhrase.Severity.HIGH),
                new Phrase("não informado", ForbiddenPhrase.Severity.HIGH),
                new Phrase("lorem ipsum", ForbiddenPhrase.Severity.HIGH),
                new Phrase("placeholder", ForbiddenPhrase.Severity.HIGH),
                new Phrase("customizado para", ForbiddenPhrase.Severity.MEDIUM),
                new Phrase("baseado em", ForbiddenPhrase.Severity.MEDIUM),
                new Phrase("específico para", ForbiddenPhrase.Severity.MEDIUM),
                new Phrase("exemplo de", ForbiddenPhrase.Severity.MEDIUM),
                new Phrase("n/a", ForbiddenPhrase.Severity.LOW));
    }

    public static class Research {
        private int minSources = 8;
        private int minContentLength = 15_000;
        private int minUniqueDomains = 5;
        private double minQualityScore = 75.0;
        private int minQualifiedExtractions = 6;

        public int getMinSources() { return minSources; }
        public void setMinSources(int minSources) { this.minSources = minSources; }

        public int getMinContentLength() { return minContentLength; }
        public void setMinContentLength(int minContentLength) { this.minContentLength = minContentLength; }

        public int getMinUniqueDomains() { return minUniqueDomains; }
        public void setMinUniqueDomains(int minUniqueDomains) { this.minUniqueDomains = minUniqueDomains; }

        public double getMinQualityScore() { return minQualityScore; }
        public void setMinQualityScore(double minQualityScore) { this.minQualityScore = minQualityScore; }

        public int getMinQualifiedExtractions() { return minQualifiedExtractions; }
        public void setMinQualifiedExtractions(int minQualifiedExtractions) { this.minQualifiedExtractions = minQualifiedExtractions; }
    }

    public static class Synthesis {
        private int minPains = 8;
        private int minDesires = 8;
        private int minInsights = 15;
        /** Insights shorter than this count as superficial. */
        private int minInsightLength = 50;
        private double maxSuperficialShare = 0.2;
        private List<String> superficialMarkers = new ArrayList<>(List.of("superficial", "genérico", "baseado em"));

        public int getMinPains() { return minPains; }
        public void setMinPains(int minPains) { this.minPains = minPains; }

        public int getMinDesires() { return minDesires; }
        public void setMinDesires(int minDesires) { this.minDesires = minDesires; }

        public int getMinInsights() { return minInsights; }
        public void setMinInsights(int minInsights) { this.minInsights = minInsights; }

        public int getMinInsightLength() { return minInsightLength; }
        public void setMinInsightLength(int minInsightLength) { this.minInsightLength = minInsightLength; }

        public double getMaxSuperficialShare() { return maxSuperficialShare; }
        public void setMaxSuperficialShare(double maxSuperficialShare) { this.maxSuperficialShare = maxSuperficialShare; }

        public List<String> getSuperficialMarkers() { return superficialMarkers; }
        public void setSuperficialMarkers(List<String> superficialMarkers) { this.superficialMarkers = superficialMarkers; }
    }

    public static class Derived {
        private int minDrivers = 5;
        private int minProofs = 3;
        private int minObjectionResponses = 3;
        private int minPrePitchPhases = 3;
        private int minScenarios = 3;
        private int minDriverNameLength = 10;
        private int minDriverNarrativeLength = 150;
        private int minProofDemonstrationLength = 100;
        private int minProofMaterials = 3;

        public int getMinDrivers() { return minDrivers; }
        public void setMinDrivers(int minDrivers) { this.minDrivers = minDrivers; }

        public int getMinProofs() { return minProofs; }
        public void setMinProofs(int minProofs) { this.minProofs = minProofs; }

        public int getMinObjectionResponses() { return minObjectionResponses; }
        public void setMinObjectionResponses(int minObjectionResponses) { this.minObjectionResponses = minObjectionResponses; }

        public int getMinPrePitchPhases() { return minPrePitchPhases; }
        public void setMinPrePitchPhases(int minPrePitchPhases) { this.minPrePitchPhases = minPrePitchPhases; }

        public int getMinScenarios() { return minScenarios; }
        public void setMinScenarios(int minScenarios) { this.minScenarios = minScenarios; }

        public int getMinDriverNameLength() { return minDriverNameLength; }
        public void setMinDriverNameLength(int minDriverNameLength) { this.minDriverNameLength = minDriverNameLength; }

        public int getMinDriverNarrativeLength() { return minDriverNarrativeLength; }
        public void setMinDriverNarrativeLength(int minDriverNarrativeLength) { this.minDriverNarrativeLength = minDriverNarrativeLength; }

        public int getMinProofDemonstrationLength() { return minProofDemonstrationLength; }
        public void setMinProofDemonstrationLength(int minProofDemonstrationLength) { this.minProofDemonstrationLength = minProofDemonstrationLength; }

        public int getMinProofMaterials() { return minProofMaterials; }
        public void setMinProofMaterials(int minProofMaterials) { this.minProofMaterials = minProofMaterials; }
    }

    public static class Phrase {
        private String phrase;
        private ForbiddenPhrase.Severity severity = ForbiddenPhrase.Severity.MEDIUM;

        public Phrase() {}

        public Phrase(String phrase, ForbiddenPhrase.Severity severity) {
            this.phrase = phrase;
            this.severity = severity;
        }

        public String getPhrase() { return phrase; }
        public void setPhrase(String phrase) { this.phrase = phrase; }

        public ForbiddenPhrase.Severity getSeverity() { return severity; }
        public void setSeverity(ForbiddenPhrase.Severity severity) { this.severity = severity; }
    }
}
