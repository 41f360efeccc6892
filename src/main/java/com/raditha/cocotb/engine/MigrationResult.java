package com.raditha.cocotb.engine;

import java.util.List;
import java.util.Objects;

/**
 * What one migration run produced.
 *
 * @param rewrittenText the output text; identical to the input when nothing changed
 * @param changed       whether the output differs from the input
 * @param diagnostics   findings in the order they were reported
 */
public record MigrationResult(String rewrittenText, boolean changed, List<Diagnostic> diagnostics) {

    public MigrationResult {
        Objects.requireNonNull(rewrittenText, "rewrittenText must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean requiresManualReview() {
        return diagnostics.stream().anyMatch(d -> d.kind() == DiagnosticKind.MANUAL_REVIEW);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }
}
