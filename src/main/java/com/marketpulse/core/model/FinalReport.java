package com.marketpulse.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Consolidated result of a completed session. Sections hold each accepted
 * stage's payload with raw components replaced by summary statistics.
 */
public record FinalReport(
        @JsonProperty("session_id") String sessionId,
        AnalysisRequest request,
        Map<String, Map<String, Object>> sections,
        @JsonProperty("quality_score") double qualityScore,
        ReportMetadata metadata
) {}
