package com.marketpulse.core.engine;

import com.marketpulse.core.model.AnalysisRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rejects requests that cannot produce a meaningful analysis before any stage runs.
 */
@Component
public class AnalysisRequestValidator {

    static final int MIN_SEGMENT_LENGTH = 5;
    static final List<String> GENERIC_TERMS = List.of("teste", "test", "exemplo", "sample");

    /**
     * @throws InputValidationException listing every problem found
     */
    public void validate(AnalysisRequest request) {
        if (request == null) {
            throw new InputValidationException(List.of("request body is required"));
        }
        List<String> errors = new ArrayList<>();

        String segment = request.segment() == null ? "" : request.segment().trim();
        if (segment.isEmpty()) {
            errors.add("segment is required");
        } else if (segment.length() < MIN_SEGMENT_LENGTH) {
            errors.add("segment must have at least " + MIN_SEGMENT_LENGTH + " characters");
        } else {
            String lower = segment.toLowerCase(Locale.ROOT);
            for (String term : GENERIC_TERMS) {
                if (lower.contains(term)) {
                    errors.add("segment must describe a real market, not a generic term ('" + term + "')");
                    break;
                }
            }
        }

        requireNonNegative(request.price(), "price", errors);
        requireNonNegative(request.revenueGoal(), "revenue_goal", errors);
        requireNonNegative(request.marketingBudget(), "marketing_budget", errors);

        if (!errors.isEmpty()) {
            throw new InputValidationException(errors);
        }
    }

    private static void requireNonNegative(Double value, String field, List<String> errors) {
        if (value != null && (value < 0 || value.isNaN())) {
            errors.add(field + " must not be negative");
        }
    }
}
