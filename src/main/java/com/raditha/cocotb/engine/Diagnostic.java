package com.raditha.cocotb.engine;

import java.util.Objects;

/**
 * A finding reported while migrating one source file.
 *
 * @param passName name of the pass that reported it, or {@code pass-runner}
 * @param kind     category of the finding
 * @param severity how urgently a human should look at it
 * @param message  human-readable description
 * @param line     1-based source line, 0 when unknown
 */
public record Diagnostic(String passName, DiagnosticKind kind, Severity severity, String message, int line) {

    public Diagnostic {
        Objects.requireNonNull(passName, "passName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Identity used to drop repeats across fixed-point iterations; the line is left out because
     * earlier rewrites may have shifted it.
     */
    public String identity() {
        return passName + "|" + kind + "|" + message;
    }

    @Override
    public String toString() {
        String where = line > 0 ? "line " + line : "line ?";
        return severity + " [" + passName + "] " + where + ": " + message;
    }
}
