package com.marketpulse.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.StageResult;
import com.marketpulse.core.session.AnalysisSession;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a session for GET /api/v1/analyses/{id}.
 */
public record SessionView(
    @JsonProperty("session_id") String sessionId,
    String status,
    String segment,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("archived_at") Instant archivedAt,
    boolean cancelled,
    List<StageView> stages,
    List<String> warnings
) {

    public record StageView(
        String stage,
        boolean success,
        String error,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("gate_score") Integer gateScore,
        @JsonProperty("gate_passed") Boolean gatePassed
    ) {}

    public static SessionView of(AnalysisSession session) {
        List<StageView> stages = session.getResults().stream()
                .map(r -> toStageView(session, r))
                .toList();
        return new SessionView(session.getId(), session.getStatus().name(), session.getRequest().segment(),
                session.getCreatedAt(), session.getFinishedAt(), session.getFailureReason(),
                session.getArchivedAt(), session.isCancelled(), stages, session.getWarnings());
    }

    private static StageView toStageView(AnalysisSession session, StageResult result) {
        QualityGateReport gate = session.gateReport(result.stageName()).orElse(null);
        return new StageView(result.stageName(), result.success(), result.error(), result.durationMs(),
                gate == null ? null : gate.score(), gate == null ? null : gate.passed());
    }
}
