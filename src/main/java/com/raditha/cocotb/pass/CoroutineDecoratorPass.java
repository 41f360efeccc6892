package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.Set;

/**
 * Turns generator-based coroutines into native ones: a function decorated with
 * {@code @cocotb.coroutine} loses the decorator and becomes {@code async def}. Other decorators
 * are kept in place, and a function that is already async only loses the marker.
 */
public class CoroutineDecoratorPass extends TransformationPass {
    public static final String NAME = "coroutine-decorator";

    private final Pattern marker;

    public CoroutineDecoratorPass(Set<String> markers) {
        this.marker = Patterns.decorator(Patterns.anyQualifiedName(markers));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getDescription() {
        return "@cocotb.coroutine def -> async def";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.FUNCTION_DEF);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return node.is(NodeKind.FUNCTION_DEF) && Nodes.decorators(node).stream().anyMatch(marker::test);
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode function, PassContext context) {
        if (!wouldTouch(function, context)) {
            return function;
        }
        logger.debug("Converting coroutine {} at line {}", Nodes.functionName(function), function.line());
        return FunctionRewrites.makeAsync(FunctionRewrites.withoutDecorators(function, marker::test));
    }
}
