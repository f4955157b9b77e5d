package com.marketpulse.core.qualitygate;

import java.util.List;

/**
 * One check applied to a stage payload.
 *
 * @param name       rule name reported in results, e.g. {@code min_sources}
 * @param fieldPath  dotted path into the payload, e.g. {@code statistics.uniqueDomains}; a segment
 *                   ending in {@code []} fans out over array elements, e.g. {@code drivers[].name},
 *                   and the rule then holds only if it holds for every element
 * @param comparator comparison to apply
 * @param threshold  numeric threshold for the MIN_* comparators, minimum item length for MAX_SHALLOW_SHARE
 * @param expected   substring for CONTAINS / NOT_CONTAINS
 * @param weight     points deducted from the score when the rule fails
 * @param critical   a failure rejects the stage regardless of score
 * @param markers    phrases that make an item shallow, for MAX_SHALLOW_SHARE
 * @param maxShare   largest tolerated share of shallow items, for MAX_SHALLOW_SHARE
 */
public record QualityRule(
        String name,
        String fieldPath,
        RuleComparator comparator,
        double threshold,
        String expected,
        int weight,
        boolean critical,
        List<String> markers,
        double maxShare
) {

    public QualityRule {
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public static QualityRule minCount(String name, String fieldPath, int min, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.MIN_COUNT, min, null, weight, false, List.of(), 0);
    }

    public static QualityRule minLength(String name, String fieldPath, int min, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.MIN_LENGTH, min, null, weight, false, List.of(), 0);
    }

    public static QualityRule minValue(String name, String fieldPath, double min, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.MIN_VALUE, min, null, weight, false, List.of(), 0);
    }

    public static QualityRule contains(String name, String fieldPath, String expected, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.CONTAINS, 0, expected, weight, false, List.of(), 0);
    }

    public static QualityRule notContains(String name, String fieldPath, String expected, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.NOT_CONTAINS, 0, expected, weight, false, List.of(), 0);
    }

    /**
     * Items of the array at {@code fieldPath} shorter than {@code minLength} or containing
     * any marker are shallow; at most {@code maxShare} of them may be.
     */
    public static QualityRule maxShallowShare(String name, String fieldPath, int minLength, List<String> markers,
                                              double maxShare, int weight) {
        return new QualityRule(name, fieldPath, RuleComparator.MAX_SHALLOW_SHARE, minLength, null, weight, false,
                markers, maxShare);
    }

    public QualityRule asCritical() {
        return new QualityRule(name, fieldPath, comparator, threshold, expected, weight, true, markers, maxShare);
    }
}
