package com.raditha.cocotb.cst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Converts Python source text into tokens without losing a single character.
 *
 * <p>
 * Whitespace, comments, blank lines and backslash continuations become {@link Trivia} attached
 * to the following token. Line breaks inside brackets are trivia as well (implicit line joining).
 * Indentation changes produce zero-width INDENT and DEDENT tokens; the indentation text itself is
 * trivia of the first token on the line.
 */
public class PythonLexer {

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "@=", "&=", "|=", "^=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Character> openBrackets = new ArrayDeque<>();
    private final Deque<SourcePosition> openBracketPositions = new ArrayDeque<>();
    private List<Trivia> pending = new ArrayList<>();
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private boolean atLineStart = true;

    public PythonLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source. The last token is always {@link TokenType#END_OF_FILE}.
     *
     * @throws ParseException on characters or literals that cannot start a token
     */
    public List<Token> tokenize() throws ParseException {
        indents.push(0);
        if (source.startsWith("\uFEFF")) {
            pending.add(new Trivia(Trivia.Kind.WHITESPACE, "\uFEFF"));
            current = 1;
            lineStart = 1;
        }
        while (!isAtEnd()) {
            if (atLineStart && openBrackets.isEmpty() && scanLineStart()) {
                continue;
            }
            if (!isAtEnd()) {
                scanToken();
            }
        }
        finish();
        return tokens;
    }

    /**
     * Handles indentation at the start of a physical line.
     *
     * @return true when the whole line was trivia (blank or comment only)
     */
    private boolean scanLineStart() throws ParseException {
        int start = current;
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            current++;
        }
        if (current > start) {
            pending.add(new Trivia(Trivia.Kind.WHITESPACE, source.substring(start, current)));
        }
        if (isAtEnd()) {
            return true;
        }
        char c = peek();
        if (c == '#') {
            scanComment();
            return true;
        }
        if (c == '\n' || c == '\r') {
            pending.add(Trivia.newline(consumeLineBreak()));
            return true;
        }
        if (c == '\\' && isLineBreakAt(current + 1)) {
            scanContinuation();
            return true;
        }

        SourcePosition position = positionOf(current);
        if (width > indents.peek()) {
            indents.push(width);
            addZeroWidth(TokenType.INDENT, position);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                addZeroWidth(TokenType.DEDENT, position);
            }
            if (width != indents.peek()) {
                throw new ParseException("unindent does not match any outer indentation level", position);
            }
        }
        atLineStart = false;
        return false;
    }

    private void scanToken() throws ParseException {
        char c = peek();
        switch (c) {
            case ' ', '\t', '\f' -> scanWhitespace();
            case '#' -> scanComment();
            case '\\' -> {
                if (!isLineBreakAt(current + 1)) {
                    throw new ParseException("unexpected character after line continuation character",
                            positionOf(current));
                }
                scanContinuation();
            }
            case '\n', '\r' -> scanLineBreak();
            case '"', '\'' -> scanString(current, false);
            default -> {
                if (isIdentifierStart(c)) {
                    scanNameOrPrefixedString();
                } else if (isDigit(c) || (c == '.' && isDigit(peekAt(current + 1)))) {
                    scanNumber();
                } else {
                    scanOperator();
                }
            }
        }
    }

    private void scanWhitespace() {
        int start = current;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            current++;
        }
        pending.add(new Trivia(Trivia.Kind.WHITESPACE, source.substring(start, current)));
    }

    private void scanComment() {
        int start = current;
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            current++;
        }
        pending.add(Trivia.comment(source.substring(start, current)));
    }

    private void scanContinuation() {
        int start = current;
        current++;
        consumeLineBreak();
        pending.add(new Trivia(Trivia.Kind.CONTINUATION, source.substring(start, current)));
    }

    private void scanLineBreak() {
        int start = current;
        String text = consumeLineBreak();
        if (!openBrackets.isEmpty()) {
            pending.add(Trivia.newline(text));
            return;
        }
        tokens.add(new Token(TokenType.NEWLINE, text, pending, positionOfBreak(start)));
        pending = new ArrayList<>();
        atLineStart = true;
    }

    private void scanNameOrPrefixedString() throws ParseException {
        int start = current;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            current++;
        }
        String word = source.substring(start, current);
        char next = peek();
        if ((next == '"' || next == '\'') && STRING_PREFIXES.contains(word.toLowerCase())) {
            current = start;
            scanString(start + word.length(), word.toLowerCase().contains("f"));
            return;
        }
        addToken(TokenType.NAME, start);
    }

    private void scanString(int quoteStart, boolean formatted) throws ParseException {
        int start = current;
        current = scanStringLiteral(quoteStart, formatted, positionOf(start));
        addToken(TokenType.STRING, start);
        trackLines(start, current);
    }

    /**
     * Finds the end of a string literal whose opening quote is at {@code quoteStart}.
     * Replacement fields of f-strings may contain nested literals of any quote style.
     *
     * @return offset just past the closing quote
     */
    private int scanStringLiteral(int quoteStart, boolean formatted, SourcePosition startPosition)
            throws ParseException {
        char quote = source.charAt(quoteStart);
        String tripleQuote = String.valueOf(quote).repeat(3);
        boolean triple = source.startsWith(tripleQuote, quoteStart);
        int i = quoteStart + (triple ? 3 : 1);
        int depth = 0;
        while (true) {
            if (i >= source.length()) {
                throw new ParseException(triple ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startPosition);
            }
            char ch = source.charAt(i);
            if (ch == '\\') {
                i += (peekAt(i + 1) == '\r' && peekAt(i + 2) == '\n') ? 3 : 2;
                continue;
            }
            if ((ch == '\n' || ch == '\r') && !triple) {
                throw new ParseException("unterminated string literal", startPosition);
            }
            if (formatted && depth > 0) {
                if (ch == '"' || ch == '\'') {
                    i = scanStringLiteral(i, false, startPosition);
                    continue;
                }
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                }
                i++;
                continue;
            }
            if (formatted && ch == '{') {
                if (peekAt(i + 1) == '{') {
                    i += 2;
                } else {
                    depth++;
                    i++;
                }
                continue;
            }
            if (ch == quote) {
                if (!triple) {
                    return i + 1;
                }
                if (source.startsWith(tripleQuote, i)) {
                    return i + 3;
                }
            }
            i++;
        }
    }

    private void scanNumber() {
        int start = current;
        char c = peek();
        char next = Character.toLowerCase(peekAt(current + 1));
        if (c == '0' && (next == 'x' || next == 'o' || next == 'b')) {
            current += 2;
            while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                current++;
            }
        } else {
            consumeDigits();
            if (peek() == '.') {
                current++;
                consumeDigits();
            }
            if (peek() == 'e' || peek() == 'E') {
                int mark = current;
                current++;
                if (peek() == '+' || peek() == '-') {
                    current++;
                }
                if (isDigit(peek())) {
                    consumeDigits();
                } else {
                    current = mark;
                }
            }
            if (peek() == 'j' || peek() == 'J') {
                current++;
            }
        }
        addToken(TokenType.NUMBER, start);
    }

    private void consumeDigits() {
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            current++;
        }
    }

    private void scanOperator() throws ParseException {
        int start = current;
        for (String op : OPERATORS) {
            if (source.startsWith(op, current)) {
                SourcePosition position = positionOf(start);
                trackBracket(op, position);
                current += op.length();
                addToken(TokenType.OPERATOR, start);
                return;
            }
        }
        throw new ParseException("invalid character '" + peek() + "'", positionOf(start));
    }

    private void trackBracket(String op, SourcePosition position) throws ParseException {
        switch (op) {
            case "(", "[", "{" -> {
                openBrackets.push(op.charAt(0));
                openBracketPositions.push(position);
            }
            case ")", "]", "}" -> {
                if (openBrackets.isEmpty()) {
                    throw new ParseException("unmatched '" + op + "'", position);
                }
                char opener = openBrackets.pop();
                openBracketPositions.pop();
                if (closerFor(opener) != op.charAt(0)) {
                    throw new ParseException("closing parenthesis '" + op
                            + "' does not match opening parenthesis '" + opener + "'", position);
                }
            }
            default -> {
                // not a bracket
            }
        }
    }

    private static char closerFor(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    private void finish() throws ParseException {
        if (!openBrackets.isEmpty()) {
            throw new ParseException("'" + openBrackets.peek() + "' was never closed", openBracketPositions.peek());
        }
        SourcePosition end = positionOf(current);
        if (!atLineStart) {
            addZeroWidth(TokenType.NEWLINE, end);
        }
        while (indents.peek() > 0) {
            indents.pop();
            addZeroWidth(TokenType.DEDENT, end);
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", pending, end));
        pending = new ArrayList<>();
    }

    private void addToken(TokenType type, int start) {
        tokens.add(new Token(type, source.substring(start, current), pending, positionOf(start)));
        pending = new ArrayList<>();
    }

    private void addZeroWidth(TokenType type, SourcePosition position) {
        tokens.add(new Token(type, "", List.of(), position));
    }

    private String consumeLineBreak() {
        int start = current;
        if (peek() == '\r' && peekAt(current + 1) == '\n') {
            current += 2;
        } else {
            current++;
        }
        line++;
        lineStart = current;
        return source.substring(start, current);
    }

    private void trackLines(int from, int to) {
        for (int i = from; i < to; i++) {
            char ch = source.charAt(i);
            if (ch == '\n' || (ch == '\r' && peekAt(i + 1) != '\n')) {
                line++;
                lineStart = i + 1;
            }
        }
    }

    private SourcePosition positionOf(int offset) {
        return new SourcePosition(line, offset - lineStart + 1, offset);
    }

    private SourcePosition positionOfBreak(int offset) {
        // consumeLineBreak already advanced the line counter
        int column = offset - previousLineStart(offset) + 1;
        return new SourcePosition(line - 1, column, offset);
    }

    private int previousLineStart(int offset) {
        int i = offset - 1;
        while (i >= 0 && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
            i--;
        }
        return i + 1;
    }

    private boolean isLineBreakAt(int offset) {
        char c = peekAt(offset);
        return c == '\n' || c == '\r';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekAt(int offset) {
        return offset < source.length() ? source.charAt(offset) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}
