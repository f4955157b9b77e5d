package com.marketpulse.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Processing metadata stamped on a {@link FinalReport}.
 *
 * @param processingDurationMs time from session creation to consolidation
 * @param providersUsed        provider that actually served each category, keyed by category key
 * @param stagesExecuted       number of stages that produced a result
 * @param warnings             skipped or rejected optional stages and other non-fatal notes
 * @param stageScores          gate score per accepted stage
 * @param generatedAt          consolidation time
 */
public record ReportMetadata(
        @JsonProperty("processing_duration_ms") long processingDurationMs,
        @JsonProperty("providers_used") Map<String, String> providersUsed,
        @JsonProperty("stages_executed") int stagesExecuted,
        List<String> warnings,
        @JsonProperty("stage_scores") Map<String, Integer> stageScores,
        @JsonProperty("generated_at") Instant generatedAt
) {}
