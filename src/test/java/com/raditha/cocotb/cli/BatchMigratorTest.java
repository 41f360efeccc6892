package com.raditha.cocotb.cli;

import com.raditha.cocotb.config.MigrationSettings;
import com.raditha.cocotb.engine.MigrationEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BatchMigrator.
 */
class BatchMigratorTest {
    private static final String LEGACY = "await RisingEdge(clk)\n";
    private static final String MIGRATED = "await cocotb.triggers.RisingEdge(clk)\n";

    private final MigrationEngine engine = new MigrationEngine(MigrationSettings.loadDefault());

    @Test
    void testSideBySideKeepsOriginal(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("tb.py"), LEGACY);

        UnitOutcome outcome = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 1).migrateFile(file);

        assertEquals(UnitOutcome.Status.CHANGED, outcome.status());
        assertEquals(tempDir.resolve("tb.migrated.py"), outcome.writtenTo());
        assertEquals(LEGACY, Files.readString(file));
        assertEquals(MIGRATED, Files.readString(outcome.writtenTo()));
        assertTrue(outcome.detections().isEmpty());
    }

    @Test
    void testInPlaceOverwrites(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("tb.py"), LEGACY);

        UnitOutcome outcome = new BatchMigrator(engine, OutputPlacement.IN_PLACE, false, 1).migrateFile(file);

        assertEquals(file, outcome.writtenTo());
        assertEquals(MIGRATED, Files.readString(file));
    }

    @Test
    void testReportOnlyWritesNothing(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("tb.py"), LEGACY);

        UnitOutcome outcome = new BatchMigrator(engine, OutputPlacement.REPORT_ONLY, true, 1).migrateFile(file);

        assertEquals(UnitOutcome.Status.CHANGED, outcome.status());
        assertNull(outcome.writtenTo());
        assertEquals(1, outcome.detections().size());
        assertEquals(LEGACY, Files.readString(file));
        assertFalse(Files.exists(tempDir.resolve("tb.migrated.py")));
    }

    @Test
    void testUnchangedFileIsNotWritten(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("tb.py"), MIGRATED);

        UnitOutcome outcome = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 1).migrateFile(file);

        assertEquals(UnitOutcome.Status.UNCHANGED, outcome.status());
        assertFalse(Files.exists(tempDir.resolve("tb.migrated.py")));
    }

    @Test
    void testParseFailureDoesNotStopBatch(@TempDir Path tempDir) throws IOException {
        Path broken = Files.writeString(tempDir.resolve("a.py"), "def f(:\n");
        Path good = Files.writeString(tempDir.resolve("b.py"), LEGACY);

        List<UnitOutcome> outcomes = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 1)
                .migrate(List.of(broken, good));

        assertEquals(UnitOutcome.Status.FAILED, outcomes.get(0).status());
        assertTrue(outcomes.get(0).error().startsWith("Parse error"), outcomes.get(0).error());
        assertEquals(UnitOutcome.Status.CHANGED, outcomes.get(1).status());
    }

    @Test
    void testDeepNestingFailsWithoutStoppingBatch(@TempDir Path tempDir) throws IOException {
        String deep = "x = " + "(".repeat(5000) + "1" + ")".repeat(5000) + "\n";
        Path broken = Files.writeString(tempDir.resolve("a_bad.py"), deep);
        Path good = Files.writeString(tempDir.resolve("b_good.py"), LEGACY);

        List<UnitOutcome> outcomes = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 1)
                .migrate(List.of(broken, good));

        assertEquals(UnitOutcome.Status.FAILED, outcomes.get(0).status());
        assertTrue(outcomes.get(0).error().contains("too many nested parentheses"), outcomes.get(0).error());
        assertEquals(UnitOutcome.Status.CHANGED, outcomes.get(1).status());
        assertEquals(MIGRATED, Files.readString(tempDir.resolve("b_good.migrated.py")));
    }

    @Test
    void testInternalErrorFailsOnlyThatFile(@TempDir Path tempDir) throws Exception {
        MigrationEngine failing = mock(MigrationEngine.class);
        when(failing.migrate("boom\n")).thenThrow(new StackOverflowError());
        when(failing.migrate(LEGACY)).thenReturn(engine.migrate(LEGACY));
        Path broken = Files.writeString(tempDir.resolve("a.py"), "boom\n");
        Path good = Files.writeString(tempDir.resolve("b.py"), LEGACY);

        List<UnitOutcome> outcomes = new BatchMigrator(failing, OutputPlacement.SIDE_BY_SIDE, false, 1)
                .migrate(List.of(broken, good));

        assertEquals(UnitOutcome.Status.FAILED, outcomes.get(0).status());
        assertTrue(outcomes.get(0).error().startsWith("Internal error"), outcomes.get(0).error());
        assertEquals(UnitOutcome.Status.CHANGED, outcomes.get(1).status());
    }

    @Test
    void testMissingFileFails(@TempDir Path tempDir) {
        UnitOutcome outcome = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 1)
                .migrateFile(tempDir.resolve("gone.py"));

        assertEquals(UnitOutcome.Status.FAILED, outcome.status());
        assertTrue(outcome.error().startsWith("I/O error"));
    }

    @Test
    void testParallelRunKeepsInputOrder(@TempDir Path tempDir) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String text = i % 3 == 0 ? MIGRATED : LEGACY;
            files.add(Files.writeString(tempDir.resolve("tb" + i + ".py"), text));
        }

        List<UnitOutcome> outcomes = new BatchMigrator(engine, OutputPlacement.SIDE_BY_SIDE, false, 4).migrate(files);

        assertEquals(files.size(), outcomes.size());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i), outcomes.get(i).file());
            UnitOutcome.Status expected = i % 3 == 0 ? UnitOutcome.Status.UNCHANGED : UnitOutcome.Status.CHANGED;
            assertEquals(expected, outcomes.get(i).status());
        }
    }

    @Test
    void testThreadCountMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new BatchMigrator(engine, OutputPlacement.REPORT_ONLY, true, 0));
    }
}
