package com.marketpulse.core.qualitygate;

import com.marketpulse.core.stages.StageNames;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-stage rulesets from {@link QualityProperties}. Stages without a
 * dedicated ruleset are only shape-checked.
 * <p>
 * Every threshold rule is critical: a payload that misses any one of them is
 * rejected whatever its score. Forbidden phrases only deduct points.
 */
@Component
public class QualityRulesetCatalog {

    private final QualityProperties properties;
    private final Map<String, QualityRuleset> rulesets;

    public QualityRulesetCatalog(QualityProperties properties) {
        this.properties = properties;
        var d = properties.getDerived();
        this.rulesets = Map.of(
                StageNames.RESEARCH, research(),
                StageNames.SYNTHESIS, synthesis(),
                StageNames.MENTAL_DRIVERS, derived(StageNames.MENTAL_DRIVERS,
                        QualityRule.minCount("min_drivers", "drivers", d.getMinDrivers(), 25),
                        QualityRule.minLength("driver_name_length", "drivers[].name", d.getMinDriverNameLength(), 10),
                        QualityRule.minLength("driver_narrative_length", "drivers[].narrative",
                                d.getMinDriverNarrativeLength(), 15)),
                StageNames.VISUAL_PROOFS, derived(StageNames.VISUAL_PROOFS,
                        QualityRule.minCount("min_proofs", "proofs", d.getMinProofs(), 25),
                        QualityRule.minLength("proof_demonstration_length", "proofs[].demonstration",
                                d.getMinProofDemonstrationLength(), 15),
                        QualityRule.minCount("proof_materials", "proofs[].materials", d.getMinProofMaterials(), 10)),
                StageNames.ANTI_OBJECTION, derived(StageNames.ANTI_OBJECTION,
                        QualityRule.minCount("min_responses", "responses", d.getMinObjectionResponses(), 25)),
                StageNames.PRE_PITCH, derived(StageNames.PRE_PITCH,
                        QualityRule.minCount("min_phases", "phases", d.getMinPrePitchPhases(), 25)),
                StageNames.FUTURE_PREDICTIONS, derived(StageNames.FUTURE_PREDICTIONS,
                        QualityRule.minCount("min_scenarios", "scenarios", d.getMinScenarios(), 25)));
    }

    public QualityRuleset rulesetFor(String stageName) {
        QualityRuleset ruleset = rulesets.get(stageName);
        return ruleset != null ? ruleset : QualityRuleset.shapeOnly(stageName, properties.minimumScoreFor(stageName));
    }

    private QualityRuleset research() {
        var r = properties.getResearch();
        return new QualityRuleset(StageNames.RESEARCH, properties.minimumScoreFor(StageNames.RESEARCH), critical(
                QualityRule.minValue("min_sources", "statistics.successfulExtractions", r.getMinSources(), 40),
                QualityRule.minValue("min_content_length", "statistics.totalContentLength", r.getMinContentLength(), 20),
                QualityRule.minValue("min_unique_domains", "statistics.uniqueDomains", r.getMinUniqueDomains(), 15),
                QualityRule.minValue("min_quality_score", "statistics.avgQualityScore", r.getMinQualityScore(), 15),
                QualityRule.minValue("min_successful_extractions", "statistics.qualifiedExtractions",
                        r.getMinQualifiedExtractions(), 10)),
                List.of());
    }

    private QualityRuleset synthesis() {
        var s = properties.getSynthesis();
        return new QualityRuleset(StageNames.SYNTHESIS, properties.minimumScoreFor(StageNames.SYNTHESIS), critical(
                QualityRule.minCount("min_pains", "avatar.pains", s.getMinPains(), 15),
                QualityRule.minCount("min_desires", "avatar.desires", s.getMinDesires(), 15),
                QualityRule.minCount("min_insights", "insights", s.getMinInsights(), 20),
                QualityRule.maxShallowShare("max_superficial_insights", "insights", s.getMinInsightLength(),
                        s.getSuperficialMarkers(), s.getMaxSuperficialShare(), 15),
                QualityRule.minCount("positioning_present", "positioning", 1, 10)),
                forbiddenPhrases());
    }

    private QualityRuleset derived(String stage, QualityRule... rules) {
        return new QualityRuleset(stage, properties.minimumScoreFor(stage), critical(rules), forbiddenPhrases());
    }

    private static List<QualityRule> critical(QualityRule... rules) {
        return Arrays.stream(rules).map(QualityRule::asCritical).toList();
    }

    private List<ForbiddenPhrase> forbiddenPhrases() {
        return properties.getForbiddenPhrases().stream()
                .map(p -> new ForbiddenPhrase(p.getPhrase(), p.getSeverity()))
                .toList();
    }
}
