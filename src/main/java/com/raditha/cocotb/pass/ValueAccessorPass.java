package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxFactory;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.Optional;
import java.util.Set;

/**
 * Replaces the removed accessors of {@code BinaryValue} handle values.
 *
 * <ul>
 * <li>{@code X.value.integer} becomes {@code int(X.value)}</li>
 * <li>{@code X.value.binstr} becomes {@code format(X.value, 'b')}</li>
 * <li>{@code X.value.raw_value} becomes {@code X.value}</li>
 * <li>{@code X.value.get_value()} becomes {@code X.value}</li>
 * </ul>
 *
 * Accessors on the left of an assignment have no rewrite and are reported instead.
 */
public class ValueAccessorPass extends TransformationPass {
    public static final String NAME = "value-accessor";

    private static final Pattern VALUE = Patterns.attributeNamed("value");
    private static final Pattern INTEGER = Patterns.attributeOf(VALUE, "integer");
    private static final Pattern BINSTR = Patterns.attributeOf(VALUE, "binstr");
    private static final Pattern RAW_VALUE = Patterns.attributeOf(VALUE, "raw_value");
    private static final Pattern GET_VALUE = Patterns.call(Patterns.attributeOf(VALUE, "get_value"))
            .and(Patterns.of("no arguments", node -> Nodes.arguments(node).isEmpty()));
    private static final Pattern ACCESSOR = Patterns.anyOf(INTEGER, BINSTR, RAW_VALUE, GET_VALUE);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 85;
    }

    @Override
    public String getDescription() {
        return "X.value.integer -> int(X.value), .binstr, .raw_value, .get_value()";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.ATTRIBUTE, NodeKind.CALL);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return ACCESSOR.test(node);
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode node, PassContext context) {
        if (!ACCESSOR.test(node)) {
            return node;
        }
        if (isAssignmentTarget(context)) {
            context.manualReview("Assignment through '" + node.toSource().strip()
                    + "' has no cocotb 2.0 equivalent; assign to the handle's value instead", node.line());
            return node;
        }
        if (GET_VALUE.test(node)) {
            SyntaxNode value = Nodes.attributeTarget(Nodes.callee(node));
            return value.withLeadingTrivia(node.leadingTrivia());
        }
        SyntaxNode value = Nodes.attributeTarget(node);
        String accessor = Nodes.attributeName(node);
        return switch (accessor) {
            case "integer" -> SyntaxFactory.call(SyntaxFactory.name("int", node.leadingTrivia()), value);
            case "binstr" -> SyntaxFactory.call(SyntaxFactory.name("format", node.leadingTrivia()),
                    value, SyntaxFactory.string("'b'"));
            default -> value;
        };
    }

    private static boolean isAssignmentTarget(PassContext context) {
        Optional<SyntaxNode> parent = context.parent();
        if (parent.isEmpty()) {
            return false;
        }
        int index = context.indexInParent();
        return switch (parent.get().kind()) {
            case ASSIGNMENT -> index < parent.get().childCount() - 1;
            case AUGMENTED_ASSIGNMENT, ANNOTATED_ASSIGNMENT -> index == 0;
            case DELETE -> true;
            default -> false;
        };
    }
}
