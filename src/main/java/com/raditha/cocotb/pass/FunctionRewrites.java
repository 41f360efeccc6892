package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxFactory;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.cst.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rewrites of function definitions shared by the decorator passes.
 */
final class FunctionRewrites {
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private FunctionRewrites() {
        // Utility class
    }

    /**
     * Inserts {@code async} before {@code def}. The new keyword takes over the leading trivia of
     * {@code def}, which is left with a single space. Returns the function itself when it is
     * already async.
     */
    static SyntaxNode makeAsync(SyntaxNode function) {
        if (Nodes.isAsync(function)) {
            return function;
        }
        int defIndex = Nodes.defKeywordIndex(function);
        SyntaxNode def = function.child(defIndex);
        SyntaxNode asyncKeyword = SyntaxFactory.keyword("async", def.leadingTrivia());
        return function
                .withChild(defIndex, def.withLeadingTrivia(SyntaxFactory.space()))
                .withChildInserted(defIndex, asyncKeyword);
    }

    /**
     * Drops the decorators accepted by {@code remove}. The blank lines and comments in front of
     * a dropped decorator move to the element that follows it; its indentation does not, since
     * that element carries its own. A comment at the end of the decorator line is kept on a
     * line of its own, at the decorator's indentation.
     */
    static SyntaxNode withoutDecorators(SyntaxNode function, Predicate<SyntaxNode> remove) {
        List<SyntaxNode> children = new ArrayList<>();
        List<Trivia> carried = null;
        for (SyntaxNode child : function.children()) {
            if (child.is(NodeKind.DECORATOR) && remove.test(child)) {
                if (carried == null) {
                    carried = new ArrayList<>();
                }
                List<Trivia> leading = child.leadingTrivia();
                List<Trivia> head = withoutTrailingWhitespace(leading);
                carried.addAll(head);
                List<Trivia> indentation = leading.subList(head.size(), leading.size());
                for (Trivia comment : innerComments(child)) {
                    carried.addAll(indentation);
                    carried.add(comment);
                    carried.add(Trivia.newline(lineEnding(child)));
                }
                continue;
            }
            if (carried != null) {
                List<Trivia> merged = new ArrayList<>(carried);
                merged.addAll(child.leadingTrivia());
                child = child.withLeadingTrivia(merged);
                carried = null;
            }
            children.add(child);
        }
        return children.size() == function.childCount() ? function : function.withChildren(children);
    }

    /**
     * Comments inside or after the decorator, i.e. in the trivia of every leaf but the first.
     */
    private static List<Trivia> innerComments(SyntaxNode decorator) {
        List<SyntaxNode> leaves = new ArrayList<>();
        decorator.collectLeaves(leaves::add);
        List<Trivia> comments = new ArrayList<>();
        for (SyntaxNode leaf : leaves.subList(1, leaves.size())) {
            for (Trivia trivia : leaf.leadingTrivia()) {
                if (trivia.kind() == Trivia.Kind.COMMENT) {
                    comments.add(trivia);
                }
            }
        }
        return comments;
    }

    private static String lineEnding(SyntaxNode decorator) {
        String text = decorator.child(decorator.childCount() - 1).token().text();
        return text.isEmpty() ? "\n" : text;
    }

    private static List<Trivia> withoutTrailingWhitespace(List<Trivia> trivia) {
        int end = trivia.size();
        while (end > 0 && trivia.get(end - 1).kind() == Trivia.Kind.WHITESPACE
                && !trivia.get(end - 1).text().equals(BYTE_ORDER_MARK)) {
            end--;
        }
        return trivia.subList(0, end);
    }
}
