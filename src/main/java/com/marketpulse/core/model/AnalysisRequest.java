package com.marketpulse.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound market-analysis request; the pipeline's initial input.
 *
 * @param segment         market segment to analyse (required, at least 5 characters)
 * @param product         product or service offered in the segment; nullable
 * @param targetAudience  description of the intended buyer; nullable
 * @param price           product price; nullable, never negative
 * @param revenueGoal     revenue objective; nullable, never negative
 * @param marketingBudget marketing budget; nullable, never negative
 * @param query           free-form research query; nullable, derived from segment and product when absent
 * @param sessionId       caller-supplied session id; nullable, generated when absent
 */
public record AnalysisRequest(
        String segment,
        String product,
        @JsonProperty("target_audience") String targetAudience,
        Double price,
        @JsonProperty("revenue_goal") Double revenueGoal,
        @JsonProperty("marketing_budget") Double marketingBudget,
        String query,
        @JsonProperty("session_id") String sessionId
) {

    public static AnalysisRequest forSegment(String segment, String product) {
        return new AnalysisRequest(segment, product, null, null, null, null, null, null);
    }

    public AnalysisRequest withSessionId(String id) {
        return new AnalysisRequest(segment, product, targetAudience, price, revenueGoal, marketingBudget, query, id);
    }

    /** The research query, falling back to segment and product. */
    public String effectiveQuery() {
        if (query != null && !query.isBlank()) {
            return query.trim();
        }
        return product == null || product.isBlank() ? segment.trim() : segment.trim() + " " + product.trim();
    }
}
