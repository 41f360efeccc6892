package com.raditha.cocotb.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds synthetic nodes for rewrites. Tokens created here carry
 * {@link SourcePosition#SYNTHETIC} and the trivia they are given, nothing else.
 */
public final class SyntaxFactory {

    private static final List<Trivia> SPACE = List.of(Trivia.space());

    private SyntaxFactory() {
        // Utility class
    }

    public static SyntaxNode token(TokenType type, String text, List<Trivia> leadingTrivia) {
        return SyntaxNode.leaf(new Token(type, text, leadingTrivia, SourcePosition.SYNTHETIC));
    }

    public static SyntaxNode operator(String text) {
        return token(TokenType.OPERATOR, text, List.of());
    }

    public static SyntaxNode keyword(String text, List<Trivia> leadingTrivia) {
        return token(TokenType.NAME, text, leadingTrivia);
    }

    public static SyntaxNode name(String identifier) {
        return name(identifier, List.of());
    }

    public static SyntaxNode name(String identifier, List<Trivia> leadingTrivia) {
        return SyntaxNode.of(NodeKind.NAME, token(TokenType.NAME, identifier, leadingTrivia));
    }

    /**
     * {@code a.b.c} as a left-nested attribute chain; a name without dots becomes a plain
     * {@link NodeKind#NAME}.
     */
    public static SyntaxNode dottedName(String qualifiedName, List<Trivia> leadingTrivia) {
        String[] segments = qualifiedName.split("\\.");
        SyntaxNode node = name(segments[0], leadingTrivia);
        for (int i = 1; i < segments.length; i++) {
            node = attribute(node, segments[i]);
        }
        return node;
    }

    public static SyntaxNode attribute(SyntaxNode target, String attributeName) {
        return SyntaxNode.of(NodeKind.ATTRIBUTE, target, operator("."),
                token(TokenType.NAME, attributeName, List.of()));
    }

    public static SyntaxNode string(String literal) {
        return SyntaxNode.of(NodeKind.STRING, token(TokenType.STRING, literal, List.of()));
    }

    /**
     * A call with positional arguments, separated by {@code ", "}. Leading trivia of the
     * argument values is replaced.
     */
    public static SyntaxNode call(SyntaxNode callee, SyntaxNode... arguments) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(operator("("));
        for (int i = 0; i < arguments.length; i++) {
            if (i > 0) {
                children.add(operator(","));
            }
            SyntaxNode value = arguments[i].withLeadingTrivia(i == 0 ? List.of() : SPACE);
            children.add(SyntaxNode.of(NodeKind.ARGUMENT, value));
        }
        children.add(operator(")"));
        return SyntaxNode.of(NodeKind.CALL, callee, SyntaxNode.of(NodeKind.ARGUMENT_LIST, children));
    }

    /**
     * {@code return} or {@code return value}; the keyword takes {@code leadingTrivia} and the
     * value is separated from it by one space.
     */
    public static SyntaxNode returnStatement(List<Trivia> leadingTrivia, SyntaxNode value) {
        SyntaxNode keyword = keyword("return", leadingTrivia);
        if (value == null) {
            return SyntaxNode.of(NodeKind.RETURN, keyword);
        }
        return SyntaxNode.of(NodeKind.RETURN, keyword, value.withLeadingTrivia(SPACE));
    }

    public static SyntaxNode await(List<Trivia> leadingTrivia, SyntaxNode operand) {
        return SyntaxNode.of(NodeKind.AWAIT, keyword("await", leadingTrivia), operand);
    }

    public static List<Trivia> space() {
        return SPACE;
    }
}
