package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.engine.PassRunResult;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.raditha.cocotb.pass.PassTestSupport.rewrite;
import static com.raditha.cocotb.pass.PassTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CoroutineDecoratorPass.
 */
class CoroutineDecoratorPassTest {

    private final CoroutineDecoratorPass pass = new CoroutineDecoratorPass(Set.of("cocotb.coroutine"));

    @Test
    void testDecoratorBecomesAsync() throws ParseException {
        String source = """
                import cocotb


                @cocotb.coroutine
                def reset(dut):
                    yield Timer(1)
                """;
        String expected = """
                import cocotb


                async def reset(dut):
                    yield Timer(1)
                """;

        PassRunResult result = run(pass, source);

        assertTrue(result.modified());
        assertEquals(expected, rewrite(pass, source));
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testDecoratorLineCommentIsKept() throws ParseException {
        String source = "@cocotb.coroutine  # note\ndef f():\n    pass\n";

        assertEquals("# note\nasync def f():\n    pass\n", rewrite(pass, source));
    }

    @Test
    void testIndentedDecoratorLineCommentIsKept() throws ParseException {
        String source = """
                class Driver:
                    # drives the bus
                    @cocotb.coroutine  # legacy
                    def drive(self):
                        pass
                """;

        assertEquals("""
                class Driver:
                    # drives the bus
                    # legacy
                    async def drive(self):
                        pass
                """, rewrite(pass, source));
    }

    @Test
    void testIndentedMethodKeepsIndentation() throws ParseException {
        String source = """
                class Driver:
                    @cocotb.coroutine
                    def drive(self):
                        pass
                """;

        assertEquals("""
                class Driver:
                    async def drive(self):
                        pass
                """, rewrite(pass, source));
    }

    @Test
    void testCommentAboveDecoratorIsKept() throws ParseException {
        String source = "# drives reset\n@cocotb.coroutine\ndef f():\n    pass\n";

        assertEquals("# drives reset\nasync def f():\n    pass\n", rewrite(pass, source));
    }

    @Test
    void testOtherDecoratorsStay() throws ParseException {
        String source = "@functools.wraps(g)\n@cocotb.coroutine\ndef f():\n    pass\n";

        assertEquals("@functools.wraps(g)\nasync def f():\n    pass\n", rewrite(pass, source));
    }

    @Test
    void testUnmarkedFunctionsAreUntouched() throws ParseException {
        String source = "@cocotb.test()\ndef t(dut):\n    pass\n\n@coroutine\ndef g():\n    pass\n";

        PassRunResult result = run(pass, source);

        assertFalse(result.modified());
        assertEquals(source, rewrite(pass, source));
    }
}
