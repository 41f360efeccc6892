package com.raditha.cocotb.match;

import com.raditha.cocotb.cst.SyntaxNode;

/**
 * Side-effect-free predicate over a syntax node.
 *
 * <p>
 * Patterns are built with the factories in {@link Patterns} and combined with {@link #and},
 * {@link #or} and {@link #negate}. The description is used in log output and test failures.
 */
public interface Pattern {

    boolean test(SyntaxNode node);

    String description();

    default Pattern and(Pattern other) {
        return Patterns.of("(" + description() + " and " + other.description() + ")",
                node -> test(node) && other.test(node));
    }

    default Pattern or(Pattern other) {
        return Patterns.of("(" + description() + " or " + other.description() + ")",
                node -> test(node) || other.test(node));
    }

    default Pattern negate() {
        return Patterns.of("not " + description(), node -> !test(node));
    }
}
