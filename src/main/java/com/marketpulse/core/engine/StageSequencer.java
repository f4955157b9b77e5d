package com.marketpulse.core.engine;

import com.marketpulse.core.consolidation.Consolidator;
import com.marketpulse.core.events.EventBus;
import com.marketpulse.core.events.PipelineEvent;
import com.marketpulse.core.logging.MdcContext;
import com.marketpulse.core.metrics.PipelineMetrics;
import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.model.StageOutcome;
import com.marketpulse.core.model.StagePayload;
import com.marketpulse.core.model.StageResult;
import com.marketpulse.core.persistence.CheckpointStore;
import com.marketpulse.core.qualitygate.QualityGateEvaluator;
import com.marketpulse.core.session.AnalysisSession;
import com.marketpulse.core.stages.StageContext;
import com.marketpulse.core.stages.StageExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a session through its stages in ordinal order.
 * <p>
 * For every stage the sequencer:
 * <ol>
 *   <li>stops if the session was cancelled</li>
 *   <li>checks that every declared dependency has an accepted result</li>
 *   <li>runs the stage and records its {@link StageResult}</li>
 *   <li>checkpoints the result before doing anything else with it</li>
 *   <li>evaluates the quality gate on success and checkpoints the report</li>
 * </ol>
 * A mandatory stage that errors aborts with {@link SessionAbortedException}; one
 * whose gate rejects aborts with {@link QualityRejectedException}. An optional
 * stage in either situation only adds a warning and contributes nothing to the
 * report. Progress events are best effort and never change the outcome, and a
 * failed checkpoint write is logged without stopping the pipeline.
 */
@Service
public class StageSequencer {

    private static final Logger log = LoggerFactory.getLogger(StageSequencer.class);

    static final String GATE_CATEGORY = "quality_gate";

    private final CheckpointStore checkpointStore;
    private final QualityGateEvaluator evaluator;
    private final Consolidator consolidator;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public StageSequencer(CheckpointStore checkpointStore, QualityGateEvaluator evaluator, Consolidator consolidator,
                          EventBus eventBus, PipelineMetrics metrics, Clock clock) {
        this.checkpointStore = checkpointStore;
        this.evaluator = evaluator;
        this.consolidator = consolidator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs every stage and consolidates the session.
     *
     * @return the final report when every mandatory stage was accepted
     * @throws SessionAbortedException   when a mandatory stage fails or the session is cancelled
     * @throws QualityRejectedException  when a mandatory stage's payload fails its gate
     * @throws IllegalStateException     when a stage is ordered before one of its dependencies
     */
    public FinalReport execute(AnalysisSession session, List<ConfiguredStage> stages) {
        List<ConfiguredStage> ordered = stages.stream()
                .sorted(Comparator.comparingInt(s -> s.definition().ordinal()))
                .toList();
        validateOrder(ordered.stream().map(ConfiguredStage::definition).toList());
        session.assignPlan(ordered.stream().map(ConfiguredStage::definition).toList());

        String sessionId = session.getId();
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {} with {} stage(s)", sessionId, ordered.size());
            notify(PipelineEvent.SESSION_STARTED, sessionId, null, Map.of("stages", ordered.size()));

            for (ConfiguredStage stage : ordered) {
                runStage(session, stage);
            }

            FinalReport report = consolidator.consolidate(session);
            session.markCompleted(clock.instant());
            metrics.recordSessionResult("completed");
            log.info("Session {} completed with quality score {}", sessionId, report.qualityScore());
            notify(PipelineEvent.SESSION_COMPLETED, sessionId, null, Map.of("qualityScore", report.qualityScore()));
            return report;
        } catch (PipelineException e) {
            session.markFailed(clock.instant(), e.getMessage());
            metrics.recordSessionResult(e instanceof QualityRejectedException ? "rejected" : "failed");
            log.error("Session {} failed: {}", sessionId, e.getMessage());
            notify(PipelineEvent.SESSION_FAILED, sessionId, null, Map.of("reason", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Verifies that every stage appears after all of its dependencies.
     *
     * @throws IllegalStateException on a duplicate stage or a dependency that does not run earlier
     */
    public static void validateOrder(List<StageDefinition> definitions) {
        Set<String> seen = new HashSet<>();
        for (StageDefinition def : definitions) {
            for (String dependency : def.dependsOn()) {
                if (!seen.contains(dependency)) {
                    throw new IllegalStateException("Stage '" + def.name() + "' depends on '" + dependency
                            + "', which does not run before it");
                }
            }
            if (!seen.add(def.name())) {
                throw new IllegalStateException("Duplicate stage '" + def.name() + "'");
            }
        }
    }

    // ── Stage execution ──────────────────────────────────────────────────

    private void runStage(AnalysisSession session, ConfiguredStage stage) {
        String sessionId = session.getId();
        StageDefinition def = stage.definition();
        MdcContext.setStage(sessionId, def.name());
        try {
            if (session.isCancelled()) {
                throw new SessionAbortedException(sessionId, def.name(), "session cancelled", null,
                        recoverCheckpoints(sessionId));
            }

            Map<String, StagePayload> inputs = new LinkedHashMap<>();
            for (String dependency : def.dependsOn()) {
                Optional<StageResult> result = session.successfulResult(dependency);
                if (result.isEmpty() || !session.isAccepted(dependency)) {
                    skipForMissingDependency(session, def, dependency);
                    return;
                }
                inputs.put(dependency, result.get().payload());
            }

            log.info("Stage '{}' started", def.name());
            notify(PipelineEvent.STAGE_STARTED, sessionId, def.name(), Map.of("ordinal", def.ordinal()));

            Instant start = clock.instant();
            StageOutcome outcome = invoke(stage, new StageContext(sessionId, session.getRequest(), inputs));
            Instant end = clock.instant();
            long durationMs = end.toEpochMilli() - start.toEpochMilli();
            outcome.warnings().forEach(session::addWarning);

            StageResult result = outcome.isSuccess()
                    ? StageResult.succeeded(def.name(), outcome.payload(), end, outcome.providersUsed(), durationMs)
                    : StageResult.failed(def.name(), outcome.message(), end, outcome.providersUsed(), durationMs);
            session.addResult(result);
            checkpoint(sessionId, def.outputType(), def.name(), result);
            metrics.recordStageDuration(def.name(), result.success(), durationMs);

            if (!result.success()) {
                handleFailure(session, def, outcome);
                return;
            }

            QualityGateReport report = evaluator.evaluate(def.name(), result.payload(), stage.ruleset());
            session.recordGateReport(report);
            checkpoint(sessionId, GATE_CATEGORY, def.name(), report);
            metrics.recordGateResult(def.name(), report.passed());
            notify(report.passed() ? PipelineEvent.GATE_PASSED : PipelineEvent.GATE_REJECTED, sessionId, def.name(),
                    Map.of("score", report.score(), "violations", report.violations()));

            if (!report.passed()) {
                if (def.required()) {
                    throw new QualityRejectedException(sessionId, report, recoverCheckpoints(sessionId));
                }
                String warning = "Optional stage '" + def.name() + "' rejected by quality gate (score "
                        + report.score() + "): " + String.join("; ", report.violations());
                session.addWarning(warning);
                log.warn(warning);
                return;
            }

            log.info("Stage '{}' completed in {} ms", def.name(), durationMs);
            notify(PipelineEvent.STAGE_COMPLETED, sessionId, def.name(),
                    Map.of("durationMs", durationMs, "score", report.score()));
        } finally {
            MdcContext.clearStage();
        }
    }

    private StageOutcome invoke(ConfiguredStage stage, StageContext context) {
        try {
            StageOutcome outcome = stage.stage().execute(context);
            if (outcome == null) {
                return StageOutcome.error("Stage returned no outcome", null);
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Stage '{}' threw an unexpected exception", stage.name(), e);
            return StageOutcome.error("Unexpected failure: " + e.getMessage(), e);
        }
    }

    private void handleFailure(AnalysisSession session, StageDefinition def, StageOutcome outcome) {
        String sessionId = session.getId();
        notify(PipelineEvent.STAGE_FAILED, sessionId, def.name(), Map.of("error", String.valueOf(outcome.message())));
        if (def.required()) {
            Throwable cause = outcome.cause() != null
                    ? outcome.cause()
                    : new StageExecutionException(def.name(), outcome.message());
            throw new SessionAbortedException(sessionId, def.name(), outcome.message(), cause,
                    recoverCheckpoints(sessionId));
        }
        String warning = "Optional stage '" + def.name() + "' failed and was skipped: " + outcome.message();
        session.addWarning(warning);
        log.warn(warning);
    }

    private void skipForMissingDependency(AnalysisSession session, StageDefinition def, String dependency) {
        String reason = "dependency '" + dependency + "' has no accepted result";
        if (def.required()) {
            throw new SessionAbortedException(session.getId(), def.name(), reason,
                    new StageExecutionException(def.name(), reason), recoverCheckpoints(session.getId()));
        }
        String warning = "Optional stage '" + def.name() + "' skipped: " + reason;
        session.addWarning(warning);
        log.warn(warning);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private void checkpoint(String sessionId, String category, String label, Object payload) {
        try {
            checkpointStore.append(sessionId, category, label, payload);
        } catch (RuntimeException e) {
            metrics.recordCheckpointFailure();
            log.warn("Checkpoint '{}' ({}) for session {} could not be written; continuing without it: {}",
                    label, category, sessionId, e.getMessage());
        }
    }

    private List<Checkpoint> recoverCheckpoints(String sessionId) {
        try {
            return checkpointStore.readSession(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not read checkpoints for session {}: {}", sessionId, e.getMessage());
            return List.of();
        }
    }

    private void notify(String type, String sessionId, String stage, Map<String, Object> payload) {
        try {
            eventBus.publish(new PipelineEvent(type, sessionId, stage, payload, clock.instant()));
        } catch (RuntimeException e) {
            log.debug("Progress event {} not delivered: {}", type, e.getMessage());
        }
    }
}
