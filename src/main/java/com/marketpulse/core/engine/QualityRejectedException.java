package com.marketpulse.core.engine;

import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.QualityGateReport;

import java.util.List;

/**
 * A mandatory stage's payload failed its quality gate.
 */
public class QualityRejectedException extends PipelineAbortException {

    private final QualityGateReport report;

    public QualityRejectedException(String sessionId, QualityGateReport report, List<Checkpoint> checkpoints) {
        super("Stage '" + report.stageName() + "' rejected by quality gate (score " + report.score()
                        + ", failed rules " + report.failedRules() + ")",
                null, sessionId, report.stageName(), checkpoints);
        this.report = report;
    }

    public QualityGateReport getReport() {
        return report;
    }
}
