package com.raditha.cocotb.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.cocotb.engine.Detection;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine.Help.Ansi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MigrationReport.
 */
class MigrationReportTest {

    private static List<UnitOutcome> outcomes() {
        Diagnostic review = new Diagnostic("keyword-removal", DiagnosticKind.MANUAL_REVIEW, Severity.WARNING,
                "Removed 'cycles=4' from clk.start()", 7);
        return List.of(
                new UnitOutcome(Path.of("a.py"), UnitOutcome.Status.CHANGED, List.of(review),
                        List.of(new Detection("keyword-removal", 7, "clk.start(cycles=4)")), null, null),
                new UnitOutcome(Path.of("b.py"), UnitOutcome.Status.UNCHANGED, List.of(), List.of(), null, null),
                UnitOutcome.failed(Path.of("c.py"), "Parse error: invalid syntax at 1:7"));
    }

    @Test
    void testCounts() {
        MigrationReport report = new MigrationReport(outcomes(), true);

        assertEquals(1, report.count(UnitOutcome.Status.CHANGED));
        assertEquals(1, report.count(UnitOutcome.Status.FAILED));
        assertFalse(report.isSuccessful());
        assertTrue(report.requiresManualReview());
        assertEquals("Files: 3 | Would change: 1 | Unchanged: 1 | Failed: 1 | Status: FAILED", report.getSummary());
    }

    @Test
    void testTextReport() {
        String text = new MigrationReport(outcomes(), true).generateReport(Ansi.OFF);

        assertTrue(text.contains("WOULD CHANGE  a.py"), text);
        assertTrue(text.contains("- line 7 [keyword-removal] clk.start(cycles=4)"), text);
        assertTrue(text.contains("MANUAL REVIEW REQUIRED"), text);
        assertTrue(text.contains("a.py:7: Removed 'cycles=4' from clk.start()"), text);
        assertTrue(text.contains("Parse error: invalid syntax at 1:7"), text);
        assertFalse(text.contains("@|"), "Markup is rendered");
        assertTrue(text.endsWith("Status: FAILED\n"));
    }

    @Test
    void testApplyModeWording() {
        List<UnitOutcome> changed = List.of(new UnitOutcome(Path.of("a.py"), UnitOutcome.Status.CHANGED,
                List.of(), List.of(), Path.of("a.migrated.py"), null));
        MigrationReport report = new MigrationReport(changed, false);

        String text = report.generateReport(Ansi.OFF);

        assertTrue(text.contains("CHANGED  a.py → a.migrated.py"), text);
        assertFalse(text.contains("MANUAL REVIEW REQUIRED"));
        assertTrue(report.isSuccessful());
        assertEquals("Files: 1 | Changed: 1 | Unchanged: 0 | Failed: 0 | Status: SUCCESS", report.getSummary());
    }

    @Test
    void testJson(@TempDir Path tempDir) throws IOException {
        MigrationReport report = new MigrationReport(outcomes(), true);
        Path file = tempDir.resolve("report.json");

        report.writeJson(file);
        JsonNode root = new ObjectMapper().readTree(file.toFile());

        assertEquals("check", root.path("summary").path("mode").asText());
        assertEquals(3, root.path("summary").path("files").asInt());
        JsonNode units = root.path("units");
        assertEquals(3, units.size());
        assertEquals("a.py", units.get(0).path("file").asText());
        assertEquals("CHANGED", units.get(0).path("status").asText());
        assertEquals("MANUAL_REVIEW", units.get(0).path("diagnostics").get(0).path("kind").asText());
        assertEquals(7, units.get(0).path("detections").get(0).path("line").asInt());
        assertTrue(units.get(0).path("writtenTo").isMissingNode());
        assertEquals("FAILED", units.get(2).path("status").asText());
        assertTrue(units.get(2).path("error").asText().startsWith("Parse error"));
        assertEquals(root, new ObjectMapper().readTree(report.toJson()));
    }
}
