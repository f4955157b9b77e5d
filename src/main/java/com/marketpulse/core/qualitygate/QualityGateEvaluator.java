package com.marketpulse.core.qualitygate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.RuleResult;
import com.marketpulse.core.model.StagePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates a stage payload against its {@link QualityRuleset}.
 * <p>
 * Evaluation order:
 * <ol>
 *   <li>shape: one critical {@code shape:<field>} failure per missing required field</li>
 *   <li>ruleset rules, in declaration order</li>
 *   <li>forbidden phrases, one result per configured phrase</li>
 * </ol>
 * The score starts at 100 and loses each failed rule's weight, floored at 0. The
 * stage passes when the score reaches the ruleset minimum and no critical rule failed.
 * <p>
 * The payload is reduced to a canonical JSON tree (sorted properties and map keys)
 * and nothing time- or randomness-dependent is consulted, so identical inputs
 * always produce identical reports.
 */
@Service
public class QualityGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEvaluator.class);

    static final int MAX_SCORE = 100;

    private final ObjectMapper canonicalMapper;

    public QualityGateEvaluator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public QualityGateReport evaluate(String stageName, StagePayload payload, QualityRuleset ruleset) {
        List<RuleResult> results = new ArrayList<>();

        if (payload == null) {
            results.add(new RuleResult("shape:payload", false, true, 0, "payload is missing"));
        } else {
            for (String field : payload.missingFields()) {
                results.add(new RuleResult("shape:" + field, false, true, 0,
                        "required field '" + field + "' is missing or empty"));
            }

            JsonNode tree = canonicalMapper.valueToTree(payload);
            for (QualityRule rule : ruleset.rules()) {
                results.add(apply(rule, tree));
            }

            if (!ruleset.forbiddenPhrases().isEmpty()) {
                String text = serialize(tree).toLowerCase(Locale.ROOT);
                for (ForbiddenPhrase phrase : ruleset.forbiddenPhrases()) {
                    boolean found = text.contains(phrase.phrase().toLowerCase(Locale.ROOT));
                    results.add(new RuleResult("forbidden_phrase:" + phrase.phrase(), !found, false,
                            phrase.severity().weight(),
                            found ? "contains forbidden phrase '" + phrase.phrase() + "' (" + phrase.severity() + ")"
                                    : "absent"));
                }
            }
        }

        int deducted = 0;
        boolean criticalFailure = false;
        List<String> violations = new ArrayList<>();
        for (RuleResult r : results) {
            if (!r.passed()) {
                deducted += r.weight();
                criticalFailure |= r.critical();
                violations.add(r.rule() + ": " + r.detail());
            }
        }
        int score = Math.max(0, MAX_SCORE - deducted);
        boolean passed = score >= ruleset.minimumScore() && !criticalFailure;

        var report = new QualityGateReport(stageName, results, score, violations, criticalFailure, passed,
                ruleset.minimumScore());
        log.info("Quality gate for '{}': {} (score {}/{}, critical failure: {}, violations: {})",
                stageName, passed ? "PASSED" : "REJECTED", score, ruleset.minimumScore(),
                criticalFailure, violations.size());
        return report;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private RuleResult apply(QualityRule rule, JsonNode tree) {
        if (!rule.fieldPath().contains("[]")) {
            return check(rule, resolve(tree, rule.fieldPath()), rule.fieldPath());
        }
        List<Located> items = resolveEach(tree, rule.fieldPath());
        List<String> failures = new ArrayList<>();
        for (Located item : items) {
            RuleResult r = check(rule, item.node(), item.path());
            if (!r.passed()) {
                failures.add(r.detail());
            }
        }
        if (failures.isEmpty()) {
            return result(rule, true, rule.fieldPath() + ": all " + items.size() + " item(s) pass");
        }
        return result(rule, false, failures.size() + " of " + items.size() + " item(s) fail, first: "
                + failures.get(0));
    }

    private RuleResult check(QualityRule rule, JsonNode node, String path) {
        return switch (rule.comparator()) {
            case MIN_COUNT -> {
                int count = node.isContainerNode() ? node.size() : 0;
                yield result(rule, count >= rule.threshold(),
                        path + " has " + count + " item(s), expected >= " + format(rule.threshold()));
            }
            case MIN_LENGTH -> {
                int length = textOf(node).length();
                yield result(rule, length >= rule.threshold(),
                        path + " length is " + length + ", expected >= " + format(rule.threshold()));
            }
            case MIN_VALUE -> {
                if (!node.isNumber()) {
                    yield result(rule, false, path + " is not a number");
                }
                double value = node.asDouble();
                yield result(rule, value >= rule.threshold(),
                        path + " = " + format(value) + ", expected >= " + format(rule.threshold()));
            }
            case CONTAINS -> {
                boolean found = containsIgnoreCase(textOf(node), rule.expected());
                yield result(rule, found, path + (found ? " contains '" : " does not contain '") + rule.expected() + "'");
            }
            case NOT_CONTAINS -> {
                boolean found = containsIgnoreCase(textOf(node), rule.expected());
                yield result(rule, !found, path + (found ? " contains '" : " does not contain '") + rule.expected() + "'");
            }
            case MAX_SHALLOW_SHARE -> {
                if (!node.isArray() || node.isEmpty()) {
                    yield result(rule, true, path + " has no items");
                }
                int shallow = 0;
                for (JsonNode item : node) {
                    if (isShallow(textOf(item), rule)) {
                        shallow++;
                    }
                }
                double share = (double) shallow / node.size();
                yield result(rule, share <= rule.maxShare(), path + " has " + shallow + " of " + node.size()
                        + " shallow item(s), expected at most " + Math.round(rule.maxShare() * 100) + "%");
            }
        };
    }

    private static boolean isShallow(String text, QualityRule rule) {
        if (text.length() < rule.threshold()) {
            return true;
        }
        for (String marker : rule.markers()) {
            if (containsIgnoreCase(text, marker)) {
                return true;
            }
        }
        return false;
    }

    private static RuleResult result(QualityRule rule, boolean passed, String detail) {
        return new RuleResult(rule.name(), passed, rule.critical(), rule.weight(), detail);
    }

    private static JsonNode resolve(JsonNode tree, String path) {
        JsonNode node = tree;
        for (String segment : path.split("\\.")) {
            node = node.path(segment);
        }
        return node;
    }

    private static List<Located> resolveEach(JsonNode tree, String path) {
        List<Located> current = List.of(new Located("", tree));
        for (String segment : path.split("\\.")) {
            boolean fanOut = segment.endsWith("[]");
            String field = fanOut ? segment.substring(0, segment.length() - 2) : segment;
            List<Located> next = new ArrayList<>();
            for (Located located : current) {
                JsonNode child = located.node().path(field);
                String childPath = located.path().isEmpty() ? field : located.path() + "." + field;
                if (!fanOut) {
                    next.add(new Located(childPath, child));
                } else if (child.isArray()) {
                    for (int i = 0; i < child.size(); i++) {
                        next.add(new Located(childPath + "[" + i + "]", child.get(i)));
                    }
                }
            }
            current = next;
        }
        return current;
    }

    private String textOf(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : serialize(node);
    }

    private String serialize(JsonNode node) {
        try {
            return canonicalMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload tree could not be serialized", e);
        }
    }

    private static boolean containsIgnoreCase(String text, String expected) {
        return expected != null && text.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private record Located(String path, JsonNode node) {}
}
