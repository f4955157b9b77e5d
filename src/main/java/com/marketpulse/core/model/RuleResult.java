package com.marketpulse.core.model;

/**
 * Result of applying a single quality rule.
 *
 * @param rule     rule name, e.g. {@code min_sources}
 * @param passed   whether the rule held
 * @param critical whether a failure rejects the stage regardless of score
 * @param weight   points deducted from the score on failure
 * @param detail   human-readable observation (expected vs actual)
 */
public record RuleResult(
        String rule,
        boolean passed,
        boolean critical,
        int weight,
        String detail
) {}
