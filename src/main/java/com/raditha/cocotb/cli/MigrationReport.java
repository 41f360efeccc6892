package com.raditha.cocotb.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.cocotb.engine.Detection;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.Severity;
import picocli.CommandLine.Help.Ansi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a batch run. Renders as coloured text for the terminal and as JSON for tools.
 */
public class MigrationReport {
    private final List<UnitOutcome> outcomes;
    private final boolean checkMode;
    private final ObjectMapper objectMapper;

    public MigrationReport(List<UnitOutcome> outcomes, boolean checkMode) {
        this.outcomes = List.copyOf(outcomes);
        this.checkMode = checkMode;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<UnitOutcome> getOutcomes() {
        return outcomes;
    }

    public long count(UnitOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    /**
     * Check if every file was processed.
     */
    public boolean isSuccessful() {
        return count(UnitOutcome.Status.FAILED) == 0;
    }

    public boolean requiresManualReview() {
        return outcomes.stream()
                .flatMap(o -> o.diagnostics().stream())
                .anyMatch(d -> d.kind() == DiagnosticKind.MANUAL_REVIEW);
    }

    /**
     * Get a concise summary of the run.
     */
    public String getSummary() {
        return String.format("Files: %d | %s: %d | Unchanged: %d | Failed: %d | Status: %s",
                outcomes.size(), checkMode ? "Would change" : "Changed", count(UnitOutcome.Status.CHANGED),
                count(UnitOutcome.Status.UNCHANGED), count(UnitOutcome.Status.FAILED),
                isSuccessful() ? "SUCCESS" : "FAILED");
    }

    /**
     * Generate the full report.
     *
     * @param ansi whether to colour the output
     */
    public String generateReport(Ansi ansi) {
        StringBuilder report = new StringBuilder();

        report.append("╔════════════════════════════════════════════════════════╗\n");
        report.append("║  cocotb 1.x → 2.x Migration Report                     ║\n");
        report.append("╚════════════════════════════════════════════════════════╝\n\n");

        for (UnitOutcome outcome : outcomes) {
            String status = switch (outcome.status()) {
                case CHANGED -> checkMode ? "@|yellow WOULD CHANGE|@" : "@|green CHANGED|@";
                case UNCHANGED -> "@|faint unchanged|@";
                case FAILED -> "@|red,bold FAILED|@";
            };
            report.append(ansi.string(status)).append("  ").append(outcome.file());
            if (outcome.writtenTo() != null && !outcome.writtenTo().equals(outcome.file())) {
                report.append(" → ").append(outcome.writtenTo());
            }
            report.append("\n");

            if (outcome.error() != null) {
                report.append("   ").append(ansi.string("@|red ❌|@ ")).append(outcome.error()).append("\n");
            }
            for (Detection detection : outcome.detections()) {
                report.append("   - line ").append(detection.line()).append(" [").append(detection.passName())
                        .append("] ").append(detection.snippet()).append("\n");
            }
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                report.append("   ").append(ansi.string(marker(diagnostic.severity()))).append(" ")
                        .append(diagnostic).append("\n");
            }
        }
        report.append("\n");

        List<String> manualReviewItems = new ArrayList<>();
        for (UnitOutcome outcome : outcomes) {
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                if (diagnostic.kind() == DiagnosticKind.MANUAL_REVIEW) {
                    manualReviewItems.add(outcome.file() + ":" + diagnostic.line() + ": " + diagnostic.message());
                }
            }
        }
        if (!manualReviewItems.isEmpty()) {
            report.append("┌─────────────────────────────────────────────────────────┐\n");
            report.append("│ ⚠️  MANUAL REVIEW REQUIRED                              │\n");
            report.append("└─────────────────────────────────────────────────────────┘\n");
            for (String item : manualReviewItems) {
                report.append("  • ").append(item).append("\n");
            }
            report.append("\n");
        }

        report.append(getSummary()).append("\n");
        return report.toString();
    }

    private static String marker(Severity severity) {
        return switch (severity) {
            case INFO -> "@|cyan ℹ|@";
            case WARNING -> "@|yellow ⚠️|@";
            case ERROR -> "@|red ❌|@";
        };
    }

    public String toJson() throws IOException {
        return objectMapper.writeValueAsString(toMap());
    }

    public void writeJson(Path file) throws IOException {
        objectMapper.writeValue(file.toFile(), toMap());
    }

    Map<String, Object> toMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("mode", checkMode ? "check" : "apply");
        summary.put("files", outcomes.size());
        summary.put("changed", count(UnitOutcome.Status.CHANGED));
        summary.put("unchanged", count(UnitOutcome.Status.UNCHANGED));
        summary.put("failed", count(UnitOutcome.Status.FAILED));

        List<Map<String, Object>> units = new ArrayList<>();
        for (UnitOutcome outcome : outcomes) {
            Map<String, Object> unit = new LinkedHashMap<>();
            unit.put("file", outcome.file().toString());
            unit.put("status", outcome.status().name());
            if (outcome.writtenTo() != null) {
                unit.put("writtenTo", outcome.writtenTo().toString());
            }
            if (outcome.error() != null) {
                unit.put("error", outcome.error());
            }
            unit.put("detections", outcome.detections());
            unit.put("diagnostics", outcome.diagnostics());
            units.add(unit);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("summary", summary);
        root.put("units", units);
        return root;
    }
}
