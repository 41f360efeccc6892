package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.Optional;
import java.util.Set;

/**
 * {@code yield Trigger(...)} becomes {@code await Trigger(...)} inside {@code async def}.
 *
 * <p>
 * Only a yield whose operand is exactly one call is rewritten. A list or tuple operand (the
 * legacy spelling of "wait for the first of these") is reported for manual review. A call or
 * collection yielded from a plain generator function is reported too, because the function has
 * to become {@code async def} first. Bare {@code yield} and {@code yield from} are left alone.
 * A parenthesized operand keeps its parentheses.
 */
public class YieldToAwaitPass extends TransformationPass {
    public static final String NAME = "yield-to-await";

    private static final Pattern YIELD_OF_CALL = Patterns.yieldOf(Patterns.anyCall());
    private static final Pattern YIELD_OF_COLLECTION = Patterns.yieldOf(
            Patterns.anyOf(Patterns.kind(NodeKind.LIST), Patterns.kind(NodeKind.TUPLE)));

    private final Pattern asyncMarker;

    /**
     * @param asyncMarkers decorators of functions that earlier passes turn into {@code async def};
     *                     yields in such functions are not reported as plain generators
     */
    public YieldToAwaitPass(Set<String> asyncMarkers) {
        this.asyncMarker = Patterns.decorator(Patterns.anyQualifiedName(asyncMarkers));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public String getDescription() {
        return "yield <call> -> await <call> in async functions";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.YIELD);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        if (!Matcher.matches(node, YIELD_OF_CALL) && !Matcher.matches(node, YIELD_OF_COLLECTION)) {
            return false;
        }
        return enclosingFunction(context).isPresent();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode node, PassContext context) {
        Optional<SyntaxNode> function = enclosingFunction(context);
        if (function.isEmpty()) {
            return node;
        }
        boolean legacyOperand = Matcher.matches(node, YIELD_OF_CALL) || Matcher.matches(node, YIELD_OF_COLLECTION);
        if (!Nodes.isAsync(function.get())) {
            if (legacyOperand && Nodes.decorators(function.get()).stream().noneMatch(asyncMarker::test)) {
                context.manualReview("yield of a trigger inside '" + Nodes.functionName(function.get())
                        + "', which is not async; the generator function must become async def", node.line());
            }
            return node;
        }
        if (Matcher.matches(node, YIELD_OF_COLLECTION)) {
            context.manualReview("yield of a list or tuple of triggers has no direct await form;"
                    + " use await First(...) or await Combine(...)", node.line());
            return node;
        }
        if (!Matcher.matches(node, YIELD_OF_CALL)) {
            return node;
        }
        SyntaxNode keyword = node.child(0);
        return SyntaxNode.of(NodeKind.AWAIT, keyword.withText("await"), node.child(1));
    }

    private static Optional<SyntaxNode> enclosingFunction(PassContext context) {
        return Nodes.innermostScope(context.ancestors()).filter(scope -> scope.is(NodeKind.FUNCTION_DEF));
    }
}
