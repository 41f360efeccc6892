package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.cst.SourcePrinter;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.PassRunResult;
import com.raditha.cocotb.match.NameTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.raditha.cocotb.pass.PassTestSupport.diagnostics;
import static com.raditha.cocotb.pass.PassTestSupport.rewrite;
import static com.raditha.cocotb.pass.PassTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeywordRemovalPass.
 */
class KeywordRemovalPassTest {

    private static final String ADVISORY = "# WARNING: Clock.start(cycles=...) was removed";

    private final KeywordRemovalPass pass = new KeywordRemovalPass(NameTable.of(Map.of("start", List.of("cycles"))),
            Map.of("start", ADVISORY));

    @Test
    void testCyclesIsRemovedWithReview() throws ParseException {
        String source = "async def t(clk):\n    clk.start(cycles=4)\n";

        PassRunResult result = run(pass, source);

        assertEquals(ADVISORY + "\nasync def t(clk):\n    clk.start()\n", rewrite(pass, source));
        List<Diagnostic> reviews = diagnostics(result, DiagnosticKind.MANUAL_REVIEW);
        assertEquals(1, reviews.size());
        assertEquals(2, reviews.get(0).line());
        assertTrue(reviews.get(0).message().startsWith("Removed 'cycles=4' from clk.start()"),
                reviews.get(0).message());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "clk.start(start_high=True, cycles=4)|clk.start(start_high=True)",
            "clk.start(cycles=4, start_high=True)|clk.start(start_high=True)",
            "Clock(c, 10).start(cycles=n)|Clock(c, 10).start()"
    })
    void testSeparatorsAreTidied(String source, String expected) throws ParseException {
        assertEquals(ADVISORY + "\n" + expected + "\n", rewrite(pass, source + "\n"));
    }

    @Test
    void testAdvisoryIsAddedOncePerFile() throws ParseException {
        // Given
        String source = "import cocotb\nclk.start(cycles=4)\nother.start(cycles=8)\n";

        // When
        PassRunResult result = run(pass, source);

        // Then
        assertEquals(ADVISORY + "\nimport cocotb\nclk.start()\nother.start()\n", SourcePrinter.print(result.tree()));
        assertEquals(2, diagnostics(result, DiagnosticKind.MANUAL_REVIEW).size());
        List<Diagnostic> advisories = diagnostics(result, DiagnosticKind.ADVISORY);
        assertEquals(1, advisories.size());
        assertEquals(1, advisories.get(0).line());
    }

    @Test
    void testMethodWithoutAdvisoryOnlyReports() throws ParseException {
        KeywordRemovalPass quiet = new KeywordRemovalPass(NameTable.of(Map.of("start", List.of("cycles"))), Map.of());

        PassRunResult result = run(quiet, "clk.start(cycles=4)\n");

        assertEquals("clk.start()\n", SourcePrinter.print(result.tree()));
        assertTrue(diagnostics(result, DiagnosticKind.ADVISORY).isEmpty());
        assertEquals(1, diagnostics(result, DiagnosticKind.MANUAL_REVIEW).size());
    }

    @Test
    void testOnlyMethodCallsAreAffected() throws ParseException {
        String source = "start(cycles=4)\nclk.restart(cycles=4)\nclk.start(4)\n";

        PassRunResult result = run(pass, source);

        assertFalse(result.modified());
        assertTrue(result.diagnostics().isEmpty());
    }
}
