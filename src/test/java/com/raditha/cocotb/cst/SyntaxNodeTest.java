package com.raditha.cocotb.cst;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SyntaxNode.
 */
class SyntaxNodeTest {

    @Test
    void testReplacingAChildSharesUntouchedSiblings() throws ParseException {
        SyntaxNode module = PythonParser.parse("a = 1\nb = 2\n");
        SyntaxNode replacement = PythonParser.parse("c = 3\n").child(0);

        SyntaxNode updated = module.withChild(0, replacement);

        assertNotSame(module, updated);
        assertSame(module.child(1), updated.child(1), "Unchanged subtrees are shared");
        assertEquals("c = 3\nb = 2\n", SourcePrinter.print(updated));
        assertEquals("a = 1\nb = 2\n", SourcePrinter.print(module), "The original tree is untouched");
    }

    @Test
    void testWithChildReturnsSameInstanceForSameChild() throws ParseException {
        SyntaxNode module = PythonParser.parse("a = 1\n");

        assertSame(module, module.withChild(0, module.child(0)));
    }

    @Test
    void testWithLeadingTriviaRebuildsOnlyThePathToFirstLeaf() throws ParseException {
        SyntaxNode statement = PythonParser.parse("    \n# c\nx = y\n").child(0);

        SyntaxNode moved = statement.withLeadingTrivia(List.of(Trivia.comment("# new"), Trivia.newline("\n")));

        assertEquals("# new\nx = y\n", moved.toSource());
        assertEquals("    \n# c\n", Trivia.toSource(statement.leadingTrivia()));
    }

    @Test
    void testTextOfSingleTokenNodes() throws ParseException {
        SyntaxNode assignment = PythonParser.parse("x = 42\n").child(0).child(0);

        assertEquals("x", assignment.child(0).text());
        assertEquals("42", assignment.child(2).text());
        assertThrows(IllegalStateException.class, assignment::text);
    }

    @Test
    void testWithTextKeepsTrivia() throws ParseException {
        SyntaxNode assignment = PythonParser.parse("x =  old\n").child(0).child(0);

        SyntaxNode renamed = assignment.withChild(2, assignment.child(2).withText("new"));

        assertEquals("x =  new", renamed.toSource());
    }

    @Test
    void testInsertAndRemoveChildren() throws ParseException {
        SyntaxNode list = PythonParser.parse("[a]\n").child(0).child(0).child(0);
        assertEquals(NodeKind.LIST, list.kind());

        SyntaxNode extended = list.withChildInserted(2, SyntaxFactory.operator(","))
                .withChildInserted(3, SyntaxFactory.name("b", SyntaxFactory.space()));
        assertEquals("[a, b]", extended.toSource());
        assertEquals("[a]", extended.withoutChild(3).withoutChild(2).toSource());
    }

    @Test
    void testTokenLeavesAreCreatedWithLeaf() {
        assertThrows(IllegalArgumentException.class, () -> SyntaxNode.of(NodeKind.TOKEN, List.of()));
        assertThrows(IllegalStateException.class, () -> SyntaxNode.of(NodeKind.PASS).token());
        assertThrows(IllegalStateException.class,
                () -> SyntaxFactory.operator("(").withChildren(List.of()));
    }

    @Test
    void testPositionSkipsSyntheticLeaves() throws ParseException {
        SyntaxNode name = PythonParser.parse("\n\nvalue\n").child(0).child(0).child(0);
        SyntaxNode call = SyntaxFactory.call(SyntaxFactory.name("int"), name);

        assertEquals(3, call.line(), "Line comes from the first leaf that was parsed");
        assertTrue(SyntaxFactory.name("x").position().isSynthetic());
        assertEquals(0, SyntaxFactory.name("x").line());
    }

    @Test
    void testIndexOfToken() throws ParseException {
        SyntaxNode function = PythonParser.parse("async def f():\n    pass\n").child(0);

        assertEquals(0, function.indexOfToken("async"));
        assertEquals(1, function.indexOfToken("def"));
        assertEquals(-1, function.indexOfToken("class"));
        assertFalse(PythonParser.parse("'def'\n").child(0).child(0).child(0).hasTokenChild("def"),
                "String tokens are never keyword matches");
    }
}
