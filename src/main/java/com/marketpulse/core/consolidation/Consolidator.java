package com.marketpulse.core.consolidation;

import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.ReportMetadata;
import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.model.StageResult;
import com.marketpulse.core.session.AnalysisSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a session's accepted stage payloads into a {@link FinalReport}.
 * <p>
 * Only stages whose result succeeded and whose quality gate passed contribute a
 * section, in ordinal order. Raw components are replaced by summary statistics.
 * The overall quality score is the weight-averaged gate score of the mandatory
 * stages.
 */
@Service
public class Consolidator {

    private static final Logger log = LoggerFactory.getLogger(Consolidator.class);

    private final RawFieldSummarizer summarizer;
    private final Clock clock;

    public Consolidator(RawFieldSummarizer summarizer, Clock clock) {
        this.summarizer = summarizer;
        this.clock = clock;
    }

    /**
     * Builds the report for a session.
     *
     * @throws IncompleteSessionException if a mandatory stage has no accepted result
     */
    public FinalReport consolidate(AnalysisSession session) {
        List<StageDefinition> plan = session.getPlan().stream()
                .sorted(Comparator.comparingInt(StageDefinition::ordinal))
                .toList();

        List<String> missing = plan.stream()
                .filter(StageDefinition::required)
                .map(StageDefinition::name)
                .filter(name -> !session.isAccepted(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new IncompleteSessionException(session.getId(), missing);
        }

        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        Map<String, Integer> stageScores = new LinkedHashMap<>();
        Map<String, String> providersUsed = new LinkedHashMap<>();
        long weightedScore = 0;
        long totalWeight = 0;

        for (StageDefinition stage : plan) {
            if (!session.isAccepted(stage.name())) {
                continue;
            }
            StageResult result = session.successfulResult(stage.name()).orElseThrow();
            QualityGateReport gate = session.gateReport(stage.name()).orElseThrow();

            sections.put(stage.name(), summarizer.summarize(result.payload()));
            stageScores.put(stage.name(), gate.score());
            for (Map.Entry<ProviderCategory, String> used : result.providersUsed().entrySet()) {
                providersUsed.put(used.getKey().key(), used.getValue());
            }
            if (stage.required()) {
                weightedScore += (long) gate.score() * stage.weight();
                totalWeight += stage.weight();
            }
        }

        double qualityScore = totalWeight == 0 ? 0.0 : Math.round(weightedScore * 100.0 / totalWeight) / 100.0;
        Instant now = clock.instant();
        var metadata = new ReportMetadata(
                Duration.between(session.getCreatedAt(), now).toMillis(),
                providersUsed,
                session.getResults().size(),
                new ArrayList<>(session.getWarnings()),
                stageScores,
                now);

        log.info("Consolidated session {}: {} section(s), quality score {}", session.getId(), sections.size(),
                qualityScore);
        return new FinalReport(session.getId(), session.getRequest(), sections, qualityScore, metadata);
    }
}
