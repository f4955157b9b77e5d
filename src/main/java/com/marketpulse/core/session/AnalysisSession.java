package com.marketpulse.core.session;

import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.SessionStatus;
import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.model.StageResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime state of one analysis request.
 * <p>
 * A session is driven by a single coordinating thread, but its state is read
 * concurrently by status and cancellation requests, so all collections are
 * thread-safe.
 */
public class AnalysisSession {

    private final String id;
    private final AnalysisRequest request;
    private final Instant createdAt;

    private final List<StageResult> results = new CopyOnWriteArrayList<>();
    private final Map<String, QualityGateReport> gateReports = new ConcurrentHashMap<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile List<StageDefinition> plan = List.of();
    private volatile SessionStatus status = SessionStatus.ACTIVE;
    private volatile Instant finishedAt;
    private volatile String failureReason;
    private volatile Instant archivedAt;

    public AnalysisSession(String id, AnalysisRequest request, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public AnalysisRequest getRequest() { return request; }
    public Instant getCreatedAt() { return createdAt; }
    public SessionStatus getStatus() { return status; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getFailureReason() { return failureReason; }
    public List<StageDefinition> getPlan() { return plan; }
    public Instant getArchivedAt() { return archivedAt; }
    public boolean isArchived() { return archivedAt != null; }

    public void assignPlan(List<StageDefinition> definitions) {
        this.plan = List.copyOf(definitions);
    }

    public void addResult(StageResult result) {
        results.add(result);
    }

    public List<StageResult> getResults() {
        return List.copyOf(results);
    }

    /** The latest successful result for a stage, if any. */
    public Optional<StageResult> successfulResult(String stageName) {
        StageResult found = null;
        for (StageResult r : results) {
            if (r.stageName().equals(stageName) && r.success()) {
                found = r;
            }
        }
        return Optional.ofNullable(found);
    }

    public void recordGateReport(QualityGateReport report) {
        gateReports.put(report.stageName(), report);
    }

    public Optional<QualityGateReport> gateReport(String stageName) {
        return Optional.ofNullable(gateReports.get(stageName));
    }

    /** Whether the stage produced a payload that passed its quality gate. */
    public boolean isAccepted(String stageName) {
        return successfulResult(stageName).isPresent()
                && gateReport(stageName).map(QualityGateReport::passed).orElse(false);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean cancel() {
        return status == SessionStatus.ACTIVE && cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void markCompleted(Instant at) {
        this.finishedAt = at;
        this.status = SessionStatus.COMPLETED;
    }

    public void markFailed(Instant at, String reason) {
        this.finishedAt = at;
        this.failureReason = reason;
        this.status = SessionStatus.FAILED;
    }

    /**
     * Drops stage payloads once the session is over, keeping status, per-stage
     * verdicts, gate reports and warnings. A session still marked active is
     * recorded as failed.
     *
     * @return false if the session was already archived
     */
    public synchronized boolean archive(Instant at) {
        if (archivedAt != null) {
            return false;
        }
        if (status == SessionStatus.ACTIVE) {
            markFailed(at, "Session ended without a terminal state");
        }
        List<StageResult> stripped = results.stream()
                .map(r -> new StageResult(r.stageName(), r.success(), null, r.error(), r.timestamp(),
                        r.providersUsed(), r.durationMs()))
                .toList();
        results.clear();
        results.addAll(stripped);
        archivedAt = at;
        return true;
    }
}
