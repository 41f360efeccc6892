package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.Set;

/**
 * Makes generator-style tests native coroutines. A test function such as
 * {@code @cocotb.test() def test_x(dut): yield ...} becomes {@code async def}; the test
 * decorator itself is still required and stays.
 */
public class AsyncTestFunctionPass extends TransformationPass {
    public static final String NAME = "async-test-function";

    private static final Pattern NESTED_SCOPE = Patterns.anyOf(Patterns.kind(NodeKind.FUNCTION_DEF),
            Patterns.kind(NodeKind.LAMBDA), Patterns.kind(NodeKind.CLASS_DEF));

    private final Pattern testMarker;

    public AsyncTestFunctionPass(Set<String> testMarkers) {
        this.testMarker = Patterns.decorator(Patterns.anyQualifiedName(testMarkers));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public String getDescription() {
        return "@cocotb.test generator -> async def";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.FUNCTION_DEF);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return node.is(NodeKind.FUNCTION_DEF)
                && !Nodes.isAsync(node)
                && Nodes.decorators(node).stream().anyMatch(testMarker::test)
                && !Matcher.findAll(Nodes.body(node), Patterns.kind(NodeKind.YIELD), NESTED_SCOPE).isEmpty();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode function, PassContext context) {
        if (!wouldTouch(function, context)) {
            return function;
        }
        logger.debug("Making test {} async at line {}", Nodes.functionName(function), function.line());
        return FunctionRewrites.makeAsync(function);
    }
}
