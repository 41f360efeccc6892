package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.PassRunResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.raditha.cocotb.pass.PassTestSupport.diagnostics;
import static com.raditha.cocotb.pass.PassTestSupport.rewrite;
import static com.raditha.cocotb.pass.PassTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QualifyNamesPass.
 */
class QualifyNamesPassTest {

    private final QualifyNamesPass pass = new QualifyNamesPass(
            List.of("cocotb.triggers.RisingEdge", "cocotb.triggers.Timer"));

    @Test
    void testBareTriggerIsQualified() throws ParseException {
        assertEquals("await cocotb.triggers.RisingEdge(clk)\n", rewrite(pass, "await RisingEdge(clk)\n"));
    }

    @Test
    void testNestedCallsAreQualified() throws ParseException {
        String source = "await First(RisingEdge(dut.clk), Timer(10))\n";

        assertEquals("await First(cocotb.triggers.RisingEdge(dut.clk), cocotb.triggers.Timer(10))\n",
                rewrite(pass, source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "await cocotb.triggers.RisingEdge(clk)\n",
            "await triggers.RisingEdge(clk)\n",
            "edge = RisingEdge\n",
            "from cocotb.triggers import RisingEdge\n",
            "await FallingEdge(clk)\n"
    })
    void testOtherCodeIsUntouched(String source) throws ParseException {
        PassRunResult result = run(pass, source);

        assertFalse(result.modified());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testSharedSimpleNameIsAmbiguous() throws ParseException {
        QualifyNamesPass ambiguous = new QualifyNamesPass(List.of("cocotb.triggers.Edge", "vendor.sim.Edge"));

        PassRunResult result = run(ambiguous, "Edge(sig)\n");

        assertEquals("cocotb.triggers.Edge(sig)\n", rewrite(ambiguous, "Edge(sig)\n"));
        List<Diagnostic> ambiguities = diagnostics(result, DiagnosticKind.AMBIGUITY);
        assertEquals(1, ambiguities.size());
        assertTrue(ambiguities.get(0).message().startsWith("'Edge' could be any of"), ambiguities.get(0).message());
    }

    @Test
    void testEntriesWithoutModuleAreIgnored() throws ParseException {
        QualifyNamesPass undotted = new QualifyNamesPass(List.of("RisingEdge"));

        assertFalse(run(undotted, "RisingEdge(clk)\n").modified());
    }
}
