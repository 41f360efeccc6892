package com.raditha.cocotb.cst;

import java.util.List;
import java.util.Objects;

/**
 * A single token together with the trivia that precedes it in the source.
 *
 * @param type          token category
 * @param text          exact token text
 * @param leadingTrivia whitespace and comments between the previous token and this one
 * @param position      where the token starts in the original text
 */
public record Token(TokenType type, String text, List<Trivia> leadingTrivia, SourcePosition position) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
        if (position == null) {
            position = SourcePosition.SYNTHETIC;
        }
    }

    public Token withText(String newText) {
        return new Token(type, newText, leadingTrivia, position);
    }

    public Token withLeadingTrivia(List<Trivia> trivia) {
        return new Token(type, text, trivia, position);
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    public boolean isName(String name) {
        return is(TokenType.NAME, name);
    }
}
