package com.raditha.cocotb.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural accessors over the child layouts documented on {@link NodeKind}.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    public static SyntaxNode callee(SyntaxNode call) {
        requireKind(call, NodeKind.CALL);
        return call.child(0);
    }

    public static SyntaxNode argumentList(SyntaxNode call) {
        requireKind(call, NodeKind.CALL);
        return call.child(1);
    }

    /**
     * The {@link NodeKind#ARGUMENT} children of a call, separators excluded.
     */
    public static List<SyntaxNode> arguments(SyntaxNode call) {
        List<SyntaxNode> arguments = new ArrayList<>();
        for (SyntaxNode child : argumentList(call).children()) {
            if (child.is(NodeKind.ARGUMENT)) {
                arguments.add(child);
            }
        }
        return arguments;
    }

    public static boolean isKeywordArgument(SyntaxNode argument) {
        return argument.is(NodeKind.ARGUMENT) && argument.childCount() == 3 && argument.child(1).isToken("=");
    }

    public static boolean isPositionalArgument(SyntaxNode argument) {
        return argument.is(NodeKind.ARGUMENT) && argument.childCount() == 1;
    }

    public static Optional<String> keywordName(SyntaxNode argument) {
        if (!isKeywordArgument(argument)) {
            return Optional.empty();
        }
        return Optional.of(argument.child(0).text());
    }

    /**
     * The value expression of an argument, whatever its form.
     */
    public static SyntaxNode argumentValue(SyntaxNode argument) {
        requireKind(argument, NodeKind.ARGUMENT);
        return isKeywordArgument(argument) || argument.child(0).isLeaf()
                ? argument.child(argument.childCount() - 1)
                : argument.child(0);
    }

    public static Optional<SyntaxNode> keywordArgument(SyntaxNode call, String keyword) {
        for (SyntaxNode argument : arguments(call)) {
            if (keywordName(argument).filter(keyword::equals).isPresent()) {
                return Optional.of(argument);
            }
        }
        return Optional.empty();
    }

    public static long positionalCount(SyntaxNode call) {
        return arguments(call).stream().filter(Nodes::isPositionalArgument).count();
    }

    public static SyntaxNode attributeTarget(SyntaxNode attribute) {
        requireKind(attribute, NodeKind.ATTRIBUTE);
        return attribute.child(0);
    }

    public static String attributeName(SyntaxNode attribute) {
        requireKind(attribute, NodeKind.ATTRIBUTE);
        return attribute.child(2).text();
    }

    /**
     * Dotted name of a {@link NodeKind#NAME} or of an attribute chain rooted at a name, such as
     * {@code cocotb.triggers.Timer}. Empty for anything else, e.g. {@code f().x}.
     */
    public static Optional<String> qualifiedName(SyntaxNode node) {
        if (node.is(NodeKind.NAME)) {
            return Optional.of(node.text());
        }
        if (node.is(NodeKind.ATTRIBUTE)) {
            return qualifiedName(attributeTarget(node)).map(prefix -> prefix + "." + attributeName(node));
        }
        return Optional.empty();
    }

    /**
     * Last segment of a name or attribute, regardless of what the attribute is taken from.
     */
    public static Optional<String> simpleName(SyntaxNode node) {
        if (node.is(NodeKind.NAME)) {
            return Optional.of(node.text());
        }
        if (node.is(NodeKind.ATTRIBUTE)) {
            return Optional.of(attributeName(node));
        }
        return Optional.empty();
    }

    public static List<SyntaxNode> decorators(SyntaxNode definition) {
        List<SyntaxNode> decorators = new ArrayList<>();
        for (SyntaxNode child : definition.children()) {
            if (!child.is(NodeKind.DECORATOR)) {
                break;
            }
            decorators.add(child);
        }
        return decorators;
    }

    public static SyntaxNode decoratorExpression(SyntaxNode decorator) {
        requireKind(decorator, NodeKind.DECORATOR);
        return decorator.child(1);
    }

    /**
     * The name a decorator refers to, with any call stripped: {@code @cocotb.test(skip=True)}
     * gives {@code cocotb.test}.
     */
    public static Optional<String> decoratorName(SyntaxNode decorator) {
        SyntaxNode expression = decoratorExpression(decorator);
        if (expression.is(NodeKind.CALL)) {
            expression = callee(expression);
        }
        return qualifiedName(expression);
    }

    public static boolean isAsync(SyntaxNode function) {
        requireKind(function, NodeKind.FUNCTION_DEF);
        return function.hasTokenChild("async");
    }

    public static int defKeywordIndex(SyntaxNode function) {
        requireKind(function, NodeKind.FUNCTION_DEF);
        return function.indexOfToken("def");
    }

    public static String functionName(SyntaxNode function) {
        return function.child(defKeywordIndex(function) + 1).text();
    }

    public static SyntaxNode body(SyntaxNode function) {
        requireKind(function, NodeKind.FUNCTION_DEF);
        return function.child(function.childCount() - 1);
    }

    /**
     * The expression inside any number of grouping parentheses: {@code ((x))} gives {@code x}.
     * A parenthesized tuple or generator is not a grouping and is returned as it is.
     */
    public static SyntaxNode unparenthesized(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.is(NodeKind.PARENTHESIZED) && current.childCount() == 3) {
            current = current.child(1);
        }
        return current;
    }

    /**
     * Removes the argument at {@code index} of an argument list's children together with one
     * separating comma. A following comma is preferred; the last argument takes the comma before
     * it. The element that moves into the removed argument's place inherits its leading trivia
     * unless its own trivia spans lines or carries a comment.
     */
    public static SyntaxNode withoutArgument(SyntaxNode argumentList, int index) {
        requireKind(argumentList, NodeKind.ARGUMENT_LIST);
        SyntaxNode removed = argumentList.child(index);
        List<SyntaxNode> children = new ArrayList<>(argumentList.children());
        if (index + 1 < children.size() && children.get(index + 1).isToken(",")) {
            children.remove(index + 1);
            children.remove(index);
            SyntaxNode next = children.get(index);
            if (next.is(NodeKind.ARGUMENT) && !spansLines(next.leadingTrivia())) {
                children.set(index, next.withLeadingTrivia(removed.leadingTrivia()));
            }
        } else if (index > 0 && children.get(index - 1).isToken(",")) {
            children.remove(index);
            children.remove(index - 1);
        } else {
            children.remove(index);
        }
        return argumentList.withChildren(children);
    }

    private static boolean spansLines(List<Trivia> trivia) {
        for (Trivia t : trivia) {
            if (t.kind() != Trivia.Kind.WHITESPACE) {
                return true;
            }
        }
        return false;
    }

    /**
     * The innermost function or lambda among the given ancestors, innermost first.
     */
    public static Optional<SyntaxNode> innermostScope(List<SyntaxNode> ancestors) {
        for (SyntaxNode ancestor : ancestors) {
            if (ancestor.is(NodeKind.FUNCTION_DEF) || ancestor.is(NodeKind.LAMBDA) || ancestor.is(NodeKind.CLASS_DEF)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    private static void requireKind(SyntaxNode node, NodeKind kind) {
        if (!node.is(kind)) {
            throw new IllegalArgumentException("Expected " + kind + " but got " + node.kind());
        }
    }
}
