package com.marketpulse.core.qualitygate;

/**
 * How a rule compares the value at its field path.
 */
public enum RuleComparator {
    /** Array or object size is at least the threshold. */
    MIN_COUNT,
    /** Text length is at least the threshold. */
    MIN_LENGTH,
    /** Numeric value is at least the threshold. */
    MIN_VALUE,
    /** Text contains the expected substring, ignoring case. */
    CONTAINS,
    /** Text does not contain the expected substring, ignoring case. */
    NOT_CONTAINS,
    /** Share of short or marker-bearing array items is at most the rule's max share. */
    MAX_SHALLOW_SHARE
}
