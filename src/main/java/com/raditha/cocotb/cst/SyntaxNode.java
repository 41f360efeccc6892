package com.raditha.cocotb.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable node of the concrete syntax tree.
 *
 * <p>
 * A node is either a {@link NodeKind#TOKEN} leaf wrapping one {@link Token}, or an interior node
 * with an ordered list of children. Every character of the source belongs to exactly one leaf,
 * either as token text or as leading trivia, so concatenating the leaves reproduces the input.
 *
 * <p>
 * All {@code with*} methods return a new node and leave the receiver untouched. Unchanged
 * subtrees are shared by reference between the old and the new tree.
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final List<SyntaxNode> children;
    private final Token token;

    private SyntaxNode(NodeKind kind, List<SyntaxNode> children, Token token) {
        this.kind = kind;
        this.children = children;
        this.token = token;
    }

    public static SyntaxNode leaf(Token token) {
        Objects.requireNonNull(token, "token must not be null");
        return new SyntaxNode(NodeKind.TOKEN, List.of(), token);
    }

    public static SyntaxNode of(NodeKind kind, List<SyntaxNode> children) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == NodeKind.TOKEN) {
            throw new IllegalArgumentException("Token leaves are created with SyntaxNode.leaf()");
        }
        return new SyntaxNode(kind, List.copyOf(children), null);
    }

    public static SyntaxNode of(NodeKind kind, SyntaxNode... children) {
        return of(kind, List.of(children));
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    public boolean isLeaf() {
        return kind == NodeKind.TOKEN;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /**
     * The wrapped token of a leaf.
     *
     * @throws IllegalStateException if this node is not a leaf
     */
    public Token token() {
        if (token == null) {
            throw new IllegalStateException(kind + " node has no token");
        }
        return token;
    }

    /**
     * Token text of a leaf; for interior nodes the text of the single leaf they wrap, which is
     * what {@link NodeKind#NAME} and single-token literals need.
     */
    public String text() {
        if (token != null) {
            return token.text();
        }
        if (children.size() == 1) {
            return children.get(0).text();
        }
        throw new IllegalStateException(kind + " node does not wrap a single token");
    }

    public boolean isToken(String text) {
        return token != null && token.text().equals(text) && token.type() != TokenType.STRING;
    }

    public SyntaxNode firstLeaf() {
        SyntaxNode current = this;
        while (!current.isLeaf()) {
            if (current.children.isEmpty()) {
                return null;
            }
            current = current.children.get(0);
        }
        return current;
    }

    public List<Trivia> leadingTrivia() {
        SyntaxNode first = firstLeaf();
        return first == null ? List.of() : first.token.leadingTrivia();
    }

    /**
     * Trivia after the node. Only a module has any; it is owned by the end-of-file token.
     */
    public List<Trivia> trailingTrivia() {
        if (kind == NodeKind.MODULE && !children.isEmpty()) {
            return children.get(children.size() - 1).leadingTrivia();
        }
        return List.of();
    }

    /**
     * Position of the first leaf that came from the source, or {@link SourcePosition#SYNTHETIC}.
     */
    public SourcePosition position() {
        List<SyntaxNode> leaves = new ArrayList<>();
        collectLeaves(leaves::add);
        for (SyntaxNode leaf : leaves) {
            if (!leaf.token.position().isSynthetic()) {
                return leaf.token.position();
            }
        }
        return SourcePosition.SYNTHETIC;
    }

    public int line() {
        return position().line();
    }

    public void collectLeaves(Consumer<SyntaxNode> consumer) {
        if (isLeaf()) {
            consumer.accept(this);
            return;
        }
        for (SyntaxNode child : children) {
            child.collectLeaves(consumer);
        }
    }

    public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
        if (isLeaf()) {
            throw new IllegalStateException("A token leaf has no children");
        }
        return new SyntaxNode(kind, List.copyOf(newChildren), null);
    }

    public SyntaxNode withChild(int index, SyntaxNode replacement) {
        if (children.get(index) == replacement) {
            return this;
        }
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return withChildren(copy);
    }

    public SyntaxNode withoutChild(int index) {
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.remove(index);
        return withChildren(copy);
    }

    public SyntaxNode withChildInserted(int index, SyntaxNode inserted) {
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.add(index, inserted);
        return withChildren(copy);
    }

    public SyntaxNode withKind(NodeKind newKind) {
        return of(newKind, children);
    }

    public SyntaxNode withText(String newText) {
        if (isLeaf()) {
            return leaf(token.withText(newText));
        }
        if (children.size() == 1) {
            return withChild(0, children.get(0).withText(newText));
        }
        throw new IllegalStateException(kind + " node does not wrap a single token");
    }

    /**
     * Replaces the leading trivia of the first leaf, rebuilding only the path down to it.
     */
    public SyntaxNode withLeadingTrivia(List<Trivia> trivia) {
        if (isLeaf()) {
            return leaf(token.withLeadingTrivia(trivia));
        }
        if (children.isEmpty()) {
            return this;
        }
        return withChild(0, children.get(0).withLeadingTrivia(trivia));
    }

    /**
     * Index of the first direct child that is a token leaf with the given text, or -1.
     */
    public int indexOfToken(String text) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).isToken(text)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasTokenChild(String text) {
        return indexOfToken(text) >= 0;
    }

    public String toSource() {
        return SourcePrinter.print(this);
    }

    @Override
    public String toString() {
        String source = toSource().strip();
        if (source.length() > 60) {
            source = source.substring(0, 57) + "...";
        }
        return kind + "[" + source + "]";
    }
}
