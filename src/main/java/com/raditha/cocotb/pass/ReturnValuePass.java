package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxFactory;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.List;
import java.util.Set;

/**
 * {@code raise ReturnValue(x)} becomes {@code return x}.
 *
 * <p>
 * Accepted argument forms: none ({@code return}), one positional value, or the keyword
 * {@code retval=x}. Anything else is reported for manual review and left unchanged.
 */
public class ReturnValuePass extends TransformationPass {
    public static final String NAME = "return-value";

    private final Pattern raiseReturnValue;

    public ReturnValuePass(Set<String> returnValueNames) {
        Pattern callee = Patterns.anyQualifiedName(returnValueNames);
        this.raiseReturnValue = Patterns.raiseOf(Patterns.call(callee));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public String getDescription() {
        return "raise ReturnValue(x) -> return x";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.RAISE);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return Matcher.matches(node, raiseReturnValue);
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode raise, PassContext context) {
        if (!Matcher.matches(raise, raiseReturnValue)) {
            return raise;
        }
        SyntaxNode call = raise.child(1);
        List<SyntaxNode> arguments = Nodes.arguments(call);
        if (arguments.isEmpty()) {
            return SyntaxFactory.returnStatement(raise.leadingTrivia(), null);
        }
        if (arguments.size() == 1) {
            SyntaxNode argument = arguments.get(0);
            boolean retval = Nodes.keywordName(argument).filter("retval"::equals).isPresent();
            if (Nodes.isPositionalArgument(argument) || retval) {
                return SyntaxFactory.returnStatement(raise.leadingTrivia(), Nodes.argumentValue(argument));
            }
        }
        context.manualReview("Cannot convert '" + call.toSource().strip() + "' to a return statement;"
                + " return the value directly", raise.line());
        return raise;
    }
}
