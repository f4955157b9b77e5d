package com.marketpulse.core.model;

import java.util.List;

/**
 * Verdict of the quality gate for one stage payload.
 *
 * @param stageName       stage that was evaluated
 * @param ruleResults     per-rule results, in ruleset order
 * @param score           aggregate score, 0 to 100
 * @param violations      messages for every failed rule
 * @param criticalFailure true when at least one critical rule failed
 * @param passed          score reached the minimum and no critical rule failed
 * @param minimumScore    minimum score the ruleset required
 */
public record QualityGateReport(
        String stageName,
        List<RuleResult> ruleResults,
        int score,
        List<String> violations,
        boolean criticalFailure,
        boolean passed,
        int minimumScore
) {
    public QualityGateReport {
        ruleResults = List.copyOf(ruleResults);
        violations = List.copyOf(violations);
    }

    public List<String> failedRules() {
        return ruleResults.stream()
                .filter(r -> !r.passed())
                .map(RuleResult::rule)
                .toList();
    }
}
