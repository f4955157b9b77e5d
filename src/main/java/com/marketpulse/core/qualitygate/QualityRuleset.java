package com.marketpulse.core.qualitygate;

import java.util.List;

/**
 * Named set of rules a stage payload must satisfy.
 */
public record QualityRuleset(
        String stageName,
        int minimumScore,
        List<QualityRule> rules,
        List<ForbiddenPhrase> forbiddenPhrases
) {
    public QualityRuleset {
        rules = rules == null ? List.of() : List.copyOf(rules);
        forbiddenPhrases = forbiddenPhrases == null ? List.of() : List.copyOf(forbiddenPhrases);
    }

    /** Shape checks only. */
    public static QualityRuleset shapeOnly(String stageName, int minimumScore) {
        return new QualityRuleset(stageName, minimumScore, List.of(), List.of());
    }
}
