package com.raditha.cocotb.cst;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PythonLexer.
 */
class PythonLexerTest {

    private static List<Token> tokenize(String source) throws ParseException {
        return new PythonLexer(source).tokenize();
    }

    @Test
    void testTriviaBelongsToFollowingToken() throws ParseException {
        List<Token> tokens = tokenize("x = 1  # note\n");

        assertEquals(TokenType.NAME, tokens.get(0).type());
        assertTrue(tokens.get(0).leadingTrivia().isEmpty());
        assertEquals(" ", Trivia.toSource(tokens.get(1).leadingTrivia()));
        assertEquals("=", tokens.get(1).text());

        Token newline = tokens.get(3);
        assertEquals(TokenType.NEWLINE, newline.type());
        assertEquals("\n", newline.text());
        assertEquals(List.of(new Trivia(Trivia.Kind.WHITESPACE, "  "), Trivia.comment("# note")),
                newline.leadingTrivia());
    }

    @Test
    void testIndentAndDedentAreZeroWidth() throws ParseException {
        List<Token> tokens = tokenize("if a:\n    b\n");

        List<TokenType> types = tokens.stream().map(Token::type).toList();
        assertEquals(List.of(TokenType.NAME, TokenType.NAME, TokenType.OPERATOR, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE, TokenType.DEDENT, TokenType.END_OF_FILE), types);

        Token indent = tokens.get(4);
        assertEquals("", indent.text());
        assertTrue(indent.leadingTrivia().isEmpty());
        assertEquals("    ", Trivia.toSource(tokens.get(5).leadingTrivia()), "Indentation is trivia of the first token");
    }

    @Test
    void testEndOfFileOwnsTrailingComments() throws ParseException {
        List<Token> tokens = tokenize("x\n\n# the end\n");

        Token eof = tokens.get(tokens.size() - 1);
        assertEquals(TokenType.END_OF_FILE, eof.type());
        assertEquals("\n# the end\n", Trivia.toSource(eof.leadingTrivia()));
    }

    @Test
    void testMissingFinalNewlineGivesEmptyNewlineToken() throws ParseException {
        List<Token> tokens = tokenize("x = 1");

        Token newline = tokens.get(tokens.size() - 2);
        assertEquals(TokenType.NEWLINE, newline.type());
        assertEquals("", newline.text());
    }

    @Test
    void testLineBreaksInsideBracketsAreTrivia() throws ParseException {
        List<Token> tokens = tokenize("f(a,\n  b)\n");

        long newlines = tokens.stream().filter(t -> t.type() == TokenType.NEWLINE).count();
        assertEquals(1, newlines, "Implicit line joining must not end the logical line");
        Token b = tokens.stream().filter(t -> t.isName("b")).findFirst().orElseThrow();
        assertEquals("\n  ", Trivia.toSource(b.leadingTrivia()));
    }

    @Test
    void testBackslashContinuation() throws ParseException {
        List<Token> tokens = tokenize("x = 1 + \\\n    2\n");

        Token two = tokens.stream().filter(t -> t.text().equals("2")).findFirst().orElseThrow();
        assertEquals(List.of(Trivia.space(), new Trivia(Trivia.Kind.CONTINUATION, "\\\n"),
                new Trivia(Trivia.Kind.WHITESPACE, "    ")), two.leadingTrivia());
        assertEquals(2, two.position().line());
    }

    @Test
    void testByteOrderMarkIsLeadingTrivia() throws ParseException {
        List<Token> tokens = tokenize("\uFEFFimport cocotb\n");

        assertEquals("import", tokens.get(0).text());
        assertEquals(new Trivia(Trivia.Kind.WHITESPACE, "\uFEFF"), tokens.get(0).leadingTrivia().get(0));
    }

    @Test
    void testCrLfLineEndingsAreKept() throws ParseException {
        List<Token> tokens = tokenize("a\r\nb\r\n");

        assertEquals("\r\n", tokens.get(1).text());
        assertEquals(2, tokens.get(2).position().line());
    }

    @Test
    void testFormattedStringIsOneToken() throws ParseException {
        List<Token> tokens = tokenize("s = f\"{d['key']!r:>{width}}\"\n");

        Token string = tokens.get(2);
        assertEquals(TokenType.STRING, string.type());
        assertEquals("f\"{d['key']!r:>{width}}\"", string.text());
    }

    @Test
    void testTripleQuotedStringAdvancesLineCount() throws ParseException {
        List<Token> tokens = tokenize("s = '''one\ntwo\nthree'''\nx = 1\n");

        Token x = tokens.stream().filter(t -> t.isName("x")).findFirst().orElseThrow();
        assertEquals(4, x.position().line());
    }

    @ParameterizedTest
    @CsvSource({
            "0x_FF", "1_000", "1e-3", "3.14", "3j", ".5", "0b1010", "0o17"
    })
    void testNumberLiterals(String literal) throws ParseException {
        List<Token> tokens = tokenize("n = " + literal + "\n");

        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(literal, tokens.get(2).text());
    }

    @Test
    void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = 1\ny = 'abc\n"));

        assertEquals("unterminated string literal", e.getReason());
        assertEquals(2, e.getLine());
    }

    @Test
    void testUnterminatedTripleQuotedString() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = \"\"\"abc\n"));

        assertEquals("unterminated triple-quoted string literal", e.getReason());
    }

    @Test
    void testUnclosedBracket() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("f(1,\n  2\n"));

        assertEquals("'(' was never closed", e.getReason());
        assertEquals(1, e.getLine());
        assertEquals(2, e.getColumn());
    }

    @Test
    void testUnmatchedClosingBracket() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x)\n"));

        assertEquals("unmatched ')'", e.getReason());
    }

    @Test
    void testMismatchedBrackets() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = [1)\n"));

        assertTrue(e.getReason().contains("does not match"), e.getReason());
    }

    @Test
    void testInconsistentDedent() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("if a:\n    b\n  c\n"));

        assertEquals("unindent does not match any outer indentation level", e.getReason());
        assertEquals(3, e.getLine());
    }

    @Test
    void testInvalidCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = 1 $ 2\n"));

        assertEquals("invalid character '$'", e.getReason());
    }
}
