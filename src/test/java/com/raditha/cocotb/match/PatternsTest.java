package com.raditha.cocotb.match;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.ParseException;
import com.raditha.cocotb.cst.PythonParser;
import com.raditha.cocotb.cst.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Patterns and Matcher.
 */
class PatternsTest {

    private static SyntaxNode expression(String source) throws ParseException {
        return PythonParser.parse(source + "\n").child(0).child(0).child(0);
    }

    @Test
    void testQualifiedNameRequiresExactSpelling() throws ParseException {
        Pattern pattern = Patterns.qualifiedName("cocotb.fork");

        assertTrue(pattern.test(expression("cocotb.fork")));
        assertFalse(pattern.test(expression("fork")));
        assertFalse(pattern.test(expression("my.cocotb.fork")));
        assertFalse(pattern.test(null), "Patterns never match a missing node");
    }

    @Test
    void testNameEndingWith() throws ParseException {
        Pattern pattern = Patterns.nameEndingWith("Clock");

        assertTrue(pattern.test(expression("Clock")));
        assertTrue(pattern.test(expression("cocotb.clock.Clock")));
        assertTrue(pattern.test(expression("make().Clock")));
        assertFalse(pattern.test(expression("ClockGen")));
    }

    @Test
    void testCallAndAttributePatterns() throws ParseException {
        SyntaxNode call = expression("cocotb.start_soon(clk.start())");

        assertTrue(Patterns.call(Patterns.qualifiedName("cocotb.start_soon")).test(call));
        assertTrue(Patterns.singlePositionalArgument(Patterns.call(Patterns.attributeNamed("start"))).test(call));
        assertFalse(Patterns.singlePositionalArgument(Patterns.anyCall())
                .test(expression("cocotb.start_soon(clk.start(), name='x')")));
        assertTrue(Patterns.attributeOf(Patterns.qualifiedName("clk"), "start")
                .test(expression("clk.start")));
        assertFalse(Patterns.attributeOf(Patterns.qualifiedName("clk"), "start")
                .test(expression("other.start")));
    }

    @Test
    void testKeywordPatterns() throws ParseException {
        SyntaxNode call = expression("Clock(dut.clk, 10, units=\"ns\")");

        assertTrue(Patterns.hasKeyword("units").test(call));
        assertFalse(Patterns.hasKeyword("unit").test(call));
        assertFalse(Patterns.hasKeyword("units").test(expression("units")));
        assertTrue(Patterns.hasAnyKeyword(List.of("unit", "units")).test(call));
        assertFalse(Patterns.hasAnyKeyword(List.of("cycles")).test(call));
    }

    static Stream<Arguments> stringLiterals() {
        return Stream.of(
                Arguments.of("'ns'", true),
                Arguments.of("\"ns\"", true),
                Arguments.of("u'ns'", true),
                Arguments.of("'''ns'''", true),
                Arguments.of("r'ns'", false),
                Arguments.of("b'ns'", false),
                Arguments.of("f'ns'", false),
                Arguments.of("'n' 's'", false),
                Arguments.of("'nss'", false));
    }

    @ParameterizedTest
    @MethodSource("stringLiterals")
    void testStringLiteral(String literal, boolean expected) throws ParseException {
        assertEquals(expected, Patterns.stringLiteral("ns").test(expression(literal)));
    }

    @ParameterizedTest
    @CsvSource({
            "16, true",
            "0x10, true",
            "0o20, true",
            "0b1_0000, true",
            "16.0, true",
            "1.6e1, true",
            "17, false",
            "16j, false"
    })
    void testNumberLiteral(String literal, boolean expected) throws ParseException {
        assertEquals(expected, Patterns.numberLiteral("16").test(expression(literal)));
    }

    @Test
    void testYieldAndRaisePatterns() throws ParseException {
        SyntaxNode module = PythonParser.parse("""
                def f():
                    yield Timer(1)
                    yield
                    yield from g()
                    raise ReturnValue(1)
                    raise ReturnValue(1) from e
                """);

        List<SyntaxNode> yields = Matcher.findAll(module, Patterns.yieldOf(Patterns.anyCall()));
        assertEquals(1, yields.size());
        assertEquals(2, yields.get(0).line());
        assertTrue(Patterns.yieldOf(Patterns.anyCall()).test(expression("(yield ((Timer(1))))").child(1)));
        assertFalse(Patterns.yieldOf(Patterns.anyCall()).test(expression("(yield (Timer(1), Timer(2)))").child(1)));

        List<SyntaxNode> raises = Matcher.findAll(module,
                Patterns.raiseOf(Patterns.call(Patterns.qualifiedName("ReturnValue"))));
        assertEquals(1, raises.size());
        assertEquals(5, raises.get(0).line());
    }

    @Test
    void testDecoratorPattern() throws ParseException {
        SyntaxNode module = PythonParser.parse("@cocotb.test(timeout=5)\n@cocotb.coroutine\ndef f():\n    pass\n");

        assertEquals(1, Matcher.findAll(module, Patterns.decorator(Patterns.qualifiedName("cocotb.test"))).size());
        assertEquals(1, Matcher.findAll(module, Patterns.decorator(Patterns.qualifiedName("cocotb.coroutine"))).size());
        assertEquals(0, Matcher.findAll(module, Patterns.decorator(Patterns.qualifiedName("cocotb.function"))).size());
    }

    @Test
    void testComposition() throws ParseException {
        Pattern timer = Patterns.call(Patterns.nameEndingWith("Timer"));
        Pattern withUnits = timer.and(Patterns.hasKeyword("units"));
        Pattern withoutUnits = timer.and(Patterns.hasKeyword("units").negate());

        assertTrue(withUnits.test(expression("Timer(1, units='ns')")));
        assertFalse(withUnits.test(expression("Timer(1)")));
        assertTrue(withoutUnits.test(expression("Timer(1)")));
        assertTrue(Patterns.kind(NodeKind.NAME).or(timer).test(expression("Timer(1)")));
        assertTrue(Patterns.allOf(timer, Patterns.any()).test(expression("Timer(1)")));
        assertFalse(Patterns.anyOf().test(expression("Timer(1)")));
    }

    @Test
    void testDescriptions() {
        Pattern pattern = Patterns.call(Patterns.qualifiedName("cocotb.fork")).and(Patterns.hasKeyword("name"));

        assertTrue(pattern.description().contains("call to name 'cocotb.fork'"), pattern.description());
        assertTrue(pattern.description().contains("has keyword 'name'"), pattern.description());
    }

    @Test
    void testFindAllIsPreOrder() throws ParseException {
        SyntaxNode module = PythonParser.parse("f(g(h()))\n");

        List<SyntaxNode> calls = Matcher.findAll(module, Patterns.anyCall());

        assertEquals(List.of("f(g(h()))", "g(h())", "h()"), calls.stream().map(SyntaxNode::toSource).toList());
        assertTrue(Matcher.matches(calls.get(2), Patterns.call(Patterns.qualifiedName("h"))));
    }

    @Test
    void testFindAllStopsAtBoundary() throws ParseException {
        SyntaxNode module = PythonParser.parse("""
                def outer():
                    yield a()
                    def inner():
                        yield b()
                    f = lambda: (yield c())
                """);
        Pattern scope = Patterns.anyOf(Patterns.kind(NodeKind.FUNCTION_DEF), Patterns.kind(NodeKind.LAMBDA));

        List<SyntaxNode> own = Matcher.findAll(Nodes.body(module.child(0)), Patterns.kind(NodeKind.YIELD), scope);

        assertEquals(List.of("yield a()"), own.stream().map(n -> n.toSource().strip()).toList());
        assertEquals(3, Matcher.findAll(module, Patterns.kind(NodeKind.YIELD)).size());
    }

    @Test
    void testAnyQualifiedName() throws ParseException {
        Pattern markers = Patterns.anyQualifiedName(List.of("cocotb.test", "cocotb.coroutine"));

        assertTrue(markers.test(expression("cocotb.coroutine")));
        assertTrue(markers.test(expression("cocotb.test")));
        assertFalse(markers.test(expression("test")));
        assertFalse(Patterns.anyQualifiedName(List.of()).test(expression("cocotb.test")));
    }
}
