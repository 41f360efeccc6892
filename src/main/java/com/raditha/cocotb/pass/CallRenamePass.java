package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxFactory;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.NameTable;

import java.util.Optional;
import java.util.Set;

/**
 * Renames the callee of calls to functions that moved, e.g. {@code fork(coro)} to
 * {@code cocotb.start_soon(coro)}. Arguments are untouched.
 *
 * <p>
 * The callee must be spelled exactly as a table key: {@code fork} does not match
 * {@code self.fork}.
 */
public class CallRenamePass extends TransformationPass {
    public static final String NAME = "call-rename";

    private final NameTable<String> renames;

    public CallRenamePass(NameTable<String> renames) {
        this.renames = renames;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public String getDescription() {
        return "fork(...) -> cocotb.start_soon(...) and other moved functions";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return newName(node).isPresent();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode call, PassContext context) {
        Optional<String> newName = newName(call);
        if (newName.isEmpty()) {
            return call;
        }
        SyntaxNode callee = Nodes.callee(call);
        logger.debug("Renaming call {} to {} at line {}", callee.toSource().strip(), newName.get(), call.line());
        return call.withChild(0, SyntaxFactory.dottedName(newName.get(), callee.leadingTrivia()));
    }

    private Optional<String> newName(SyntaxNode call) {
        if (!call.is(NodeKind.CALL)) {
            return Optional.empty();
        }
        Optional<String> current = Nodes.qualifiedName(Nodes.callee(call));
        return current.flatMap(name -> renames.exact(name).filter(target -> !target.equals(name)));
    }
}
