package com.marketpulse.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.marketpulse.core.engine.AnalysisService;
import com.marketpulse.core.engine.InputValidationException;
import com.marketpulse.core.engine.PipelineException;
import com.marketpulse.core.engine.QualityRejectedException;
import com.marketpulse.core.engine.SessionAbortedException;
import com.marketpulse.core.events.EventBus;
import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.session.AnalysisSession;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: marketpulse analyze --segment "&lt;segment&gt;" [--product ...]
 * <p>
 * Runs the full pipeline in the foreground, printing events as stages progress.
 * Exit codes: 0 completed, 1 failed or aborted, 2 invalid input, 3 quality rejected.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Run a market analysis")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_REJECTED = 3;

    @Option(names = {"--segment", "-s"}, required = true, description = "Market segment to analyse")
    private String segment;

    @Option(names = {"--product", "-p"}, description = "Product or service offered")
    private String product;

    @Option(names = "--audience", description = "Target audience description")
    private String targetAudience;

    @Option(names = "--price", description = "Product price")
    private Double price;

    @Option(names = "--revenue-goal", description = "Revenue objective")
    private Double revenueGoal;

    @Option(names = "--budget", description = "Marketing budget")
    private Double marketingBudget;

    @Option(names = {"--query", "-q"}, description = "Research query (defaults to segment and product)")
    private String query;

    @Option(names = "--session-id", description = "Session id to use instead of a generated one")
    private String sessionId;

    @Option(names = "--json", description = "Print the full report as JSON")
    private boolean json;

    private final AnalysisService analysisService;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(AnalysisService analysisService, EventBus eventBus, ObjectMapper objectMapper) {
        this.analysisService = analysisService;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var request = new AnalysisRequest(segment, product, targetAudience, price, revenueGoal,
                marketingBudget, query, sessionId);

        AnalysisSession session;
        try {
            session = analysisService.open(request);
        } catch (InputValidationException e) {
            ConsoleOutput.error("Invalid request:");
            e.getErrors().forEach(err -> ConsoleOutput.error("  " + err));
            return EXIT_INVALID;
        }

        ConsoleOutput.info("Session " + session.getId() + " for segment '" + segment + "'");
        EventBus.Subscription subscription = eventBus.subscribe(session.getId(), ConsoleOutput::event);
        try {
            FinalReport report = analysisService.run(session);
            printGateReports(session);
            ConsoleOutput.report(report);
            if (json) {
                System.out.println(toJson(report));
            }
            ConsoleOutput.success("Analysis complete.");
            return 0;
        } catch (QualityRejectedException e) {
            printGateReports(session);
            ConsoleOutput.error("Quality gate rejected stage '" + e.getStage() + "'");
            ConsoleOutput.info(e.getCheckpoints().size() + " checkpoint(s) kept for session " + e.getSessionId());
            return EXIT_REJECTED;
        } catch (SessionAbortedException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.info(e.getCheckpoints().size() + " checkpoint(s) kept for session " + e.getSessionId());
            return EXIT_FAILED;
        } catch (PipelineException e) {
            ConsoleOutput.error("Analysis failed: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }
    }

    private void printGateReports(AnalysisSession session) {
        for (var result : session.getResults()) {
            session.gateReport(result.stageName()).ifPresent(ConsoleOutput::gateReport);
        }
    }

    private String toJson(FinalReport report) {
        try {
            return objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
