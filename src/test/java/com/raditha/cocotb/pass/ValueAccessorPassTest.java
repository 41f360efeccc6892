package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.engine.Diagnostic;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.PassRunResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.raditha.cocotb.pass.PassTestSupport.diagnostics;
import static com.raditha.cocotb.pass.PassTestSupport.rewrite;
import static com.raditha.cocotb.pass.PassTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ValueAccessorPass.
 */
class ValueAccessorPassTest {

    private final ValueAccessorPass pass = new ValueAccessorPass();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x = dut.sig.value.integer|x = int(dut.sig.value)",
            "s = dut.bus.value.binstr|s = format(dut.bus.value, 'b')",
            "r = dut.sig.value.raw_value|r = dut.sig.value",
            "v = dut.sig.value.get_value()|v = dut.sig.value",
            "log(dut.a.value.integer + 1)|log(int(dut.a.value) + 1)"
    })
    void testAccessorsAreReplaced(String source, String expected) throws ParseException {
        assertEquals(expected + "\n", rewrite(pass, source + "\n"));
    }

    @Test
    void testConditionIsRewritten() throws ParseException {
        String source = "if dut.sig.value.integer == 3:\n    pass\n";

        assertEquals("if int(dut.sig.value) == 3:\n    pass\n", rewrite(pass, source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "dut.sig.value.integer = 5\n",
            "dut.sig.value.integer += 1\n"
    })
    void testAssignmentTargetsNeedReview(String source) throws ParseException {
        PassRunResult result = run(pass, source);

        assertFalse(result.modified());
        List<Diagnostic> reviews = diagnostics(result, DiagnosticKind.MANUAL_REVIEW);
        assertEquals(1, reviews.size());
        assertTrue(reviews.get(0).message().startsWith("Assignment through 'dut.sig.value.integer'"),
                reviews.get(0).message());
    }

    @Test
    void testOtherAttributesAreUntouched() throws ParseException {
        String source = "x = dut.sig.integer\ny = dut.sig.value\nz = dut.sig.value.get_value(1)\n";

        PassRunResult result = run(pass, source);

        assertFalse(result.modified());
        assertTrue(result.diagnostics().isEmpty());
    }
}
