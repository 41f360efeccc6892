package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.Set;

/**
 * {@code cocotb.start_soon(clock.start())} becomes {@code clock.start()}: a clock starts itself
 * and no longer has to be scheduled as a task.
 */
public class StartSoonUnwrapPass extends TransformationPass {
    public static final String NAME = "start-soon-unwrap";

    private final Pattern scheduledStart;

    public StartSoonUnwrapPass(Set<String> schedulers, String startMethod) {
        Pattern scheduler = Patterns.anyQualifiedName(schedulers);
        this.scheduledStart = Patterns.call(scheduler)
                .and(Patterns.singlePositionalArgument(Patterns.call(Patterns.attributeNamed(startMethod))));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public String getDescription() {
        return "cocotb.start_soon(clock.start()) -> clock.start()";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return Matcher.matches(node, scheduledStart);
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode call, PassContext context) {
        if (!Matcher.matches(call, scheduledStart)) {
            return call;
        }
        SyntaxNode inner = Nodes.argumentValue(Nodes.arguments(call).get(0));
        return inner.withLeadingTrivia(call.leadingTrivia());
    }
}
