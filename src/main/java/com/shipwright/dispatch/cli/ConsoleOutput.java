package com.shipwright.dispatch.cli;

import com.shipwright.core.model.DeploymentAttempt;
import com.shipwright.core.model.DeploymentSnapshot;
import com.shipwright.core.model.MonitoringResult;
import com.shipwright.core.model.RollbackResult;
import com.shipwright.core.model.SmokeTestReport;
import com.shipwright.core.model.StageRecord;
import com.shipwright.core.model.ValidationReport;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Shipwright CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHIPWRIGHT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHIPWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(StageRecord record) {
        String status = record.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + record.stage() + "]|@ " + status + " " + record.message()
                        + " (" + formatDuration(record.durationMs()) + ")"));
        Object logs = record.details().get("containerLogs");
        if (logs instanceof String text && !text.isBlank()) {
            System.out.println("      container logs:");
            text.lines().forEach(line -> System.out.println("        | " + line));
        }
    }

    public static void validation(ValidationReport report) {
        for (var check : report.checks()) {
            String status = check.passed() ? "@|fg(green) +|@" : "@|fg(red) x|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "      " + status + " " + check.name() + ": " + check.message()));
        }
        for (String skipped : report.skippedChecks()) {
            System.out.println("      - " + skipped + ": skipped");
        }
    }

    public static void smokeTests(SmokeTestReport report) {
        for (var result : report.results()) {
            String status = result.passed() ? "@|fg(green) +|@" : "@|fg(red) x|@";
            String timing = result.gotResponse() ? String.format(" [%.1fms]", result.responseTimeMs()) : "";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "      " + status + " " + result.testName() + ": " + result.message() + timing));
        }
    }

    public static void monitoring(MonitoringResult result) {
        System.out.println(String.format("      %d samples, %d failed, health rate %.1f%%, avg %.1fms",
                result.sampleCount(), result.failedCount(), result.healthRate() * 100, result.avgResponseTimeMs()));
    }

    public static void rollback(RollbackResult result) {
        if (result.success()) {
            success("Rollback: " + result.message());
        } else {
            error("Rollback: " + result.message());
        }
        System.out.println("      previous: " + result.previousRef() + ", restored: " + result.newRef());
    }

    public static void metrics(List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold METRICS|@"));
        lines.forEach(line -> System.out.println("  " + line));
    }

    public static void snapshot(DeploymentSnapshot s) {
        String artifact = s.hasArtifact() ? s.artifactTag() : "(nothing running)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + s.versionId() + "|@  " + s.timestamp() + "  " + s.environment()
                        + "  port " + s.port() + "  " + artifact
                        + (s.hasDataBackup() ? "  +data" : "")));
    }

    /**
     * Stage-by-stage summary of a finished attempt.
     */
    public static void attempt(DeploymentAttempt attempt) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold ATTEMPT " + attempt.attemptId() + "|@ (" + attempt.environment() + ", " + attempt.mode() + ")"));
        attempt.artifactTag().ifPresent(tag -> System.out.println("  Artifact: " + tag));
        attempt.snapshotVersion().ifPresent(v -> System.out.println("  Snapshot: " + v));
        System.out.println();

        for (var record : attempt.stages()) {
            stage(record);
            switch (record.stage()) {
                case VALIDATING -> attempt.validationReport().ifPresent(ConsoleOutput::validation);
                case SMOKE_TESTING -> attempt.smokeTestReport().ifPresent(ConsoleOutput::smokeTests);
                case MONITORING -> attempt.monitoringResult().ifPresent(ConsoleOutput::monitoring);
                default -> { }
            }
        }
        attempt.rollbackResult().ifPresent(ConsoleOutput::rollback);

        System.out.println(RULE);
        String duration = formatDuration(attempt.duration().toMillis());
        if (attempt.succeeded()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [" + attempt.finalStatus() + "]|@ in " + duration));
        } else {
            String gate = attempt.failedGate()
                    .filter(g -> g != attempt.finalStatus())
                    .map(g -> " after " + g)
                    .orElse("");
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [" + attempt.finalStatus() + "]|@" + gate + " in " + duration));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
