package com.raditha.cocotb.match;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Factories for the predicate forms the rewrite passes are written with.
 *
 * <p>
 * Example, the shape {@code cocotb.start_soon(<x>.start())}:
 *
 * <pre>
 * Pattern pattern = Patterns.call(Patterns.qualifiedName("cocotb.start_soon"))
 *         .and(Patterns.singlePositionalArgument(
 *                 Patterns.call(Patterns.attributeNamed("start"))));
 * </pre>
 */
public final class Patterns {

    private Patterns() {
        // Utility class
    }

    private record Described(String description, Predicate<SyntaxNode> predicate) implements Pattern {
        @Override
        public boolean test(SyntaxNode node) {
            return node != null && predicate.test(node);
        }

        @Override
        public String toString() {
            return description;
        }
    }

    public static Pattern of(String description, Predicate<SyntaxNode> predicate) {
        return new Described(description, predicate);
    }

    public static Pattern any() {
        return of("any", node -> true);
    }

    public static Pattern kind(NodeKind kind) {
        return of("kind " + kind, node -> node.is(kind));
    }

    /**
     * A name or attribute chain spelling exactly {@code dotted}, e.g. {@code cocotb.coroutine}.
     */
    public static Pattern qualifiedName(String dotted) {
        return of("name '" + dotted + "'",
                node -> Nodes.qualifiedName(node).filter(dotted::equals).isPresent());
    }

    /**
     * Any of the dotted names in {@code names}.
     */
    public static Pattern anyQualifiedName(Collection<String> names) {
        return anyOf(names.stream().sorted().map(Patterns::qualifiedName).toArray(Pattern[]::new));
    }

    /**
     * A name equal to {@code simpleName}, or an attribute whose last segment is
     * {@code simpleName}, whatever it is taken from.
     */
    public static Pattern nameEndingWith(String simpleName) {
        return of("name ending with '" + simpleName + "'",
                node -> Nodes.simpleName(node).filter(simpleName::equals).isPresent());
    }

    public static Pattern attributeNamed(String attributeName) {
        return of("attribute '" + attributeName + "'",
                node -> node.is(NodeKind.ATTRIBUTE) && Nodes.attributeName(node).equals(attributeName));
    }

    public static Pattern attributeOf(Pattern target, String attributeName) {
        return of(target.description() + "." + attributeName,
                node -> node.is(NodeKind.ATTRIBUTE) && Nodes.attributeName(node).equals(attributeName)
                        && target.test(Nodes.attributeTarget(node)));
    }

    /**
     * A call whose callee matches {@code callee}.
     */
    public static Pattern call(Pattern callee) {
        return of("call to " + callee.description(),
                node -> node.is(NodeKind.CALL) && callee.test(Nodes.callee(node)));
    }

    public static Pattern anyCall() {
        return kind(NodeKind.CALL);
    }

    /**
     * A call with a keyword argument named {@code keyword}.
     */
    public static Pattern hasKeyword(String keyword) {
        return of("has keyword '" + keyword + "'",
                node -> node.is(NodeKind.CALL) && Nodes.keywordArgument(node, keyword).isPresent());
    }

    public static Pattern hasAnyKeyword(Collection<String> keywords) {
        return anyOf(keywords.stream().sorted().map(Patterns::hasKeyword).toArray(Pattern[]::new));
    }

    /**
     * A call with exactly one argument, positional, matching {@code argument}.
     */
    public static Pattern singlePositionalArgument(Pattern argument) {
        return of("single argument " + argument.description(), node -> {
            if (!node.is(NodeKind.CALL)) {
                return false;
            }
            var arguments = Nodes.arguments(node);
            return arguments.size() == 1 && Nodes.isPositionalArgument(arguments.get(0))
                    && argument.test(Nodes.argumentValue(arguments.get(0)));
        });
    }

    /**
     * A plain string literal with the given content. Quote style and a {@code u} prefix are
     * ignored; raw, byte and formatted strings and implicit concatenations never match.
     */
    public static Pattern stringLiteral(String value) {
        return of("string '" + value + "'",
                node -> node.is(NodeKind.STRING) && stringContent(node).filter(value::equals).isPresent());
    }

    /**
     * A number literal numerically equal to {@code value}: {@code 0x10}, {@code 16} and
     * {@code 16.0} all match 16.
     */
    public static Pattern numberLiteral(String value) {
        BigDecimal expected = new BigDecimal(value);
        return of("number " + value,
                node -> node.is(NodeKind.NUMBER)
                        && numericValue(node.text()).filter(v -> v.compareTo(expected) == 0).isPresent());
    }

    /**
     * {@code yield <operand>}, looking through parentheses around the operand; bare
     * {@code yield} and {@code yield from} never match.
     */
    public static Pattern yieldOf(Pattern operand) {
        return of("yield " + operand.description(),
                node -> node.is(NodeKind.YIELD) && node.childCount() == 2
                        && operand.test(Nodes.unparenthesized(node.child(1))));
    }

    /**
     * {@code raise <exception>} without a {@code from} clause.
     */
    public static Pattern raiseOf(Pattern exception) {
        return of("raise " + exception.description(),
                node -> node.is(NodeKind.RAISE) && node.childCount() == 2 && exception.test(node.child(1)));
    }

    /**
     * A decorator whose expression, or the callee of its call, matches {@code name}.
     */
    public static Pattern decorator(Pattern name) {
        return of("@" + name.description(), node -> {
            if (!node.is(NodeKind.DECORATOR)) {
                return false;
            }
            SyntaxNode expression = Nodes.decoratorExpression(node);
            return name.test(expression) || (expression.is(NodeKind.CALL) && name.test(Nodes.callee(expression)));
        });
    }

    public static Pattern allOf(Pattern... patterns) {
        return of(join(" and ", patterns), node -> Arrays.stream(patterns).allMatch(p -> p.test(node)));
    }

    public static Pattern anyOf(Pattern... patterns) {
        return of(join(" or ", patterns), node -> Arrays.stream(patterns).anyMatch(p -> p.test(node)));
    }

    private static String join(String separator, Pattern... patterns) {
        return Arrays.stream(patterns).map(Pattern::description).collect(Collectors.joining(separator, "(", ")"));
    }

    static Optional<String> stringContent(SyntaxNode node) {
        if (node.childCount() != 1) {
            return Optional.empty();
        }
        String text = node.text();
        int quoteStart = 0;
        while (quoteStart < text.length() && Character.isLetter(text.charAt(quoteStart))) {
            quoteStart++;
        }
        String prefix = text.substring(0, quoteStart).toLowerCase();
        if (!prefix.isEmpty() && !prefix.equals("u")) {
            return Optional.empty();
        }
        String body = text.substring(quoteStart);
        int quoteLength = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
        if (body.length() < 2 * quoteLength) {
            return Optional.empty();
        }
        return Optional.of(body.substring(quoteLength, body.length() - quoteLength));
    }

    static Optional<BigDecimal> numericValue(String literal) {
        String text = literal.replace("_", "").toLowerCase();
        if (text.endsWith("j")) {
            return Optional.empty();
        }
        try {
            if (text.startsWith("0x")) {
                return Optional.of(new BigDecimal(new BigInteger(text.substring(2), 16)));
            }
            if (text.startsWith("0o")) {
                return Optional.of(new BigDecimal(new BigInteger(text.substring(2), 8)));
            }
            if (text.startsWith("0b")) {
                return Optional.of(new BigDecimal(new BigInteger(text.substring(2), 2)));
            }
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
