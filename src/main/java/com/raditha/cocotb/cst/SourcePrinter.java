package com.raditha.cocotb.cst;

/**
 * Turns a syntax tree back into source text.
 *
 * <p>
 * Output is the concatenation, in tree order, of every leaf's leading trivia followed by its
 * token text. For a tree that came straight out of {@link PythonParser} this is exactly the
 * parsed input.
 */
public final class SourcePrinter {

    private SourcePrinter() {
        // Utility class
    }

    public static String print(SyntaxNode node) {
        StringBuilder sb = new StringBuilder();
        node.collectLeaves(leaf -> {
            Token token = leaf.token();
            for (Trivia trivia : token.leadingTrivia()) {
                sb.append(trivia.text());
            }
            sb.append(token.text());
        });
        return sb.toString();
    }
}
