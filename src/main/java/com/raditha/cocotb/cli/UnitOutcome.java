package com.raditha.cocotb.cli;

import com.raditha.cocotb.engine.Detection;
import com.raditha.cocotb.engine.Diagnostic;

import java.nio.file.Path;
import java.util.List;

/**
 * What happened to one file in a batch.
 *
 * @param file        the source file
 * @param status      changed, unchanged or failed
 * @param diagnostics findings of the migration run
 * @param detections  pre-scan findings; only filled in check mode
 * @param writtenTo   the file the result was written to, or null
 * @param error       why the file failed, or null
 */
public record UnitOutcome(Path file, Status status, List<Diagnostic> diagnostics, List<Detection> detections,
        Path writtenTo, String error) {

    public enum Status {
        CHANGED,
        UNCHANGED,
        FAILED
    }

    public UnitOutcome {
        diagnostics = List.copyOf(diagnostics);
        detections = List.copyOf(detections);
    }

    public static UnitOutcome failed(Path file, String error) {
        return new UnitOutcome(file, Status.FAILED, List.of(), List.of(), null, error);
    }
}
