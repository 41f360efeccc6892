package com.raditha.cocotb.cst;

import java.util.List;
import java.util.Objects;

/**
 * Non-semantic source text attached to a token: whitespace, comments, blank lines and
 * backslash continuations.
 *
 * @param kind what the text is
 * @param text the exact source characters
 */
public record Trivia(Kind kind, String text) {

    public enum Kind {
        WHITESPACE,
        COMMENT,
        /** A line break that does not end a logical line. */
        NEWLINE,
        /** A backslash followed by a line break. */
        CONTINUATION
    }

    public Trivia {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static Trivia space() {
        return new Trivia(Kind.WHITESPACE, " ");
    }

    public static Trivia comment(String text) {
        return new Trivia(Kind.COMMENT, text);
    }

    public static Trivia newline(String text) {
        return new Trivia(Kind.NEWLINE, text);
    }

    /**
     * Concatenates the text of the given trivia.
     */
    public static String toSource(List<Trivia> trivia) {
        StringBuilder sb = new StringBuilder();
        for (Trivia t : trivia) {
            sb.append(t.text());
        }
        return sb.toString();
    }
}
