package com.marketpulse.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.model.QualityGateReport;

import java.util.List;

/**
 * JSON response for POST /api/v1/analyses. Exactly one of the outcome-specific
 * fields is populated:
 * <ul>
 *   <li>COMPLETED: {@code report}</li>
 *   <li>QUALITY_REJECTED: {@code gate_report} and {@code checkpoints}</li>
 *   <li>PARTIAL: {@code reason}, {@code stage} and {@code checkpoints}</li>
 *   <li>INVALID / FAILED: {@code errors}</li>
 * </ul>
 */
public record AnalysisResponse(
    Outcome outcome,
    @JsonProperty("session_id") String sessionId,
    FinalReport report,
    String stage,
    String reason,
    @JsonProperty("gate_report") QualityGateReport gateReport,
    List<Checkpoint> checkpoints,
    List<String> errors
) {

    public enum Outcome { COMPLETED, QUALITY_REJECTED, PARTIAL, INVALID, FAILED }

    public static AnalysisResponse completed(FinalReport report) {
        return new AnalysisResponse(Outcome.COMPLETED, report.sessionId(), report, null, null, null, null, null);
    }

    public static AnalysisResponse rejected(String sessionId, QualityGateReport gateReport, List<Checkpoint> checkpoints) {
        return new AnalysisResponse(Outcome.QUALITY_REJECTED, sessionId, null, gateReport.stageName(),
                "Quality gate rejected stage '" + gateReport.stageName() + "'", gateReport, checkpoints, null);
    }

    public static AnalysisResponse partial(String sessionId, String stage, String reason, List<Checkpoint> checkpoints) {
        return new AnalysisResponse(Outcome.PARTIAL, sessionId, null, stage, reason, null, checkpoints, null);
    }

    public static AnalysisResponse invalid(List<String> errors) {
        return new AnalysisResponse(Outcome.INVALID, null, null, null, null, null, null, errors);
    }

    public static AnalysisResponse failed(String sessionId, String error) {
        return new AnalysisResponse(Outcome.FAILED, sessionId, null, null, null, null, null, List.of(error));
    }
}
