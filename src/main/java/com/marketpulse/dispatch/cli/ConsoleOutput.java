package com.marketpulse.dispatch.cli;

import com.marketpulse.core.events.PipelineEvent;
import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.model.QualityGateReport;
import com.marketpulse.core.model.RuleResult;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the MarketPulse CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) MARKETPULSE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [MARKETPULSE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(ansi("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case PipelineEvent.SESSION_STARTED -> "@|fg(cyan) [SESSION]|@";
            case PipelineEvent.STAGE_STARTED, PipelineEvent.STAGE_COMPLETED -> "@|fg(blue) [STAGE]|@";
            case PipelineEvent.STAGE_FAILED -> "@|fg(red) [STAGE]|@";
            case PipelineEvent.GATE_PASSED -> "@|fg(green),bold [QUALITY_GATE]|@";
            case PipelineEvent.GATE_REJECTED -> "@|fg(red),bold [QUALITY_GATE]|@";
            case PipelineEvent.SESSION_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case PipelineEvent.SESSION_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String stage = event.stage() == null ? "" : event.stage() + " ";
        System.out.println(ansi(prefix + " " + stage + event.eventType()));
    }

    public static void gateReport(QualityGateReport report) {
        String verdict = report.passed()
                ? "@|fg(green),bold [QUALITY_GATE PASSED]|@"
                : "@|fg(red),bold [QUALITY_GATE REJECTED]|@";
        System.out.println(ansi("  " + verdict + " " + report.stageName()
                + " score " + report.score() + "/" + report.minimumScore()));
        for (RuleResult rule : report.ruleResults()) {
            if (!rule.passed()) {
                String marker = rule.critical() ? "@|fg(red) - [critical]|@ " : "@|fg(red) -|@ ";
                System.out.println(ansi("    " + marker + rule.rule() + ": " + rule.detail()));
            }
        }
    }

    public static void checkpoint(Checkpoint checkpoint) {
        System.out.printf("  #%-5d %-20s %-22s %s%n",
                checkpoint.sequence(), checkpoint.stage(), checkpoint.category(), checkpoint.timestamp());
    }

    public static void report(FinalReport report) {
        System.out.println(RULE);
        System.out.println(ansi("@|bold Analysis Report " + report.sessionId() + "|@"));
        System.out.println("  Quality score: " + String.format("%.2f", report.qualityScore()));
        System.out.println("  Sections: " + String.join(", ", report.sections().keySet()));
        System.out.println("  Stages executed: " + report.metadata().stagesExecuted());
        for (Map.Entry<String, Integer> score : report.metadata().stageScores().entrySet()) {
            System.out.println("    " + score.getKey() + ": " + score.getValue());
        }
        for (Map.Entry<String, String> provider : report.metadata().providersUsed().entrySet()) {
            System.out.println("  Provider (" + provider.getKey() + "): " + provider.getValue());
        }
        System.out.println("  Duration: " + formatDuration(report.metadata().processingDurationMs()));
        for (String warning : report.metadata().warnings()) {
            warn(warning);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
