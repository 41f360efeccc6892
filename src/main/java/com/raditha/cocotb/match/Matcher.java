package com.raditha.cocotb.match;

import com.raditha.cocotb.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for testing patterns against trees.
 */
public final class Matcher {

    private Matcher() {
        // Utility class
    }

    public static boolean matches(SyntaxNode node, Pattern pattern) {
        return pattern.test(node);
    }

    /**
     * Every node of {@code root}, in pre-order, that matches {@code pattern}.
     */
    public static List<SyntaxNode> findAll(SyntaxNode root, Pattern pattern) {
        return findAll(root, pattern, Patterns.of("nothing", node -> false));
    }

    /**
     * Like {@link #findAll(SyntaxNode, Pattern)}, but the subtrees of descendants matching
     * {@code boundary} are not searched. The boundary nodes themselves are still tested.
     */
    public static List<SyntaxNode> findAll(SyntaxNode root, Pattern pattern, Pattern boundary) {
        List<SyntaxNode> found = new ArrayList<>();
        if (pattern.test(root)) {
            found.add(root);
        }
        for (SyntaxNode child : root.children()) {
            collect(child, pattern, boundary, found);
        }
        return found;
    }

    private static void collect(SyntaxNode node, Pattern pattern, Pattern boundary, List<SyntaxNode> found) {
        if (pattern.test(node)) {
            found.add(node);
        }
        if (boundary.test(node)) {
            return;
        }
        for (SyntaxNode child : node.children()) {
            collect(child, pattern, boundary, found);
        }
    }
}
