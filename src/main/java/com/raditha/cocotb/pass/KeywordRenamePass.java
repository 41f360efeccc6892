package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.Severity;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.NameTable;
import com.raditha.cocotb.match.Patterns;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renames keyword arguments of selected callables, e.g. {@code Clock(clk, 10, units="ns")} to
 * {@code Clock(clk, 10, unit="ns")}. Values and all other arguments are untouched.
 *
 * <p>
 * Callees are looked up in a {@link NameTable}, so {@code Clock} also covers
 * {@code cocotb.clock.Clock}. A rename that would duplicate a keyword already present is
 * skipped and reported.
 */
public class KeywordRenamePass extends TransformationPass {
    public static final String NAME = "keyword-rename";

    private final NameTable<Map<String, String>> renames;

    public KeywordRenamePass(NameTable<Map<String, String>> renames) {
        this.renames = renames;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    public String getDescription() {
        return "Clock/Timer units= -> unit= and other renamed keywords";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        if (!node.is(NodeKind.CALL)) {
            return false;
        }
        return lookup(node)
                .filter(l -> Matcher.matches(node, Patterns.hasAnyKeyword(l.value().keySet())))
                .isPresent();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode call, PassContext context) {
        Optional<NameTable.Lookup<Map<String, String>>> lookup = lookup(call);
        if (lookup.isEmpty()) {
            return call;
        }
        Map<String, String> table = lookup.get().value();
        SyntaxNode argumentList = Nodes.argumentList(call);
        SyntaxNode updated = argumentList;
        List<SyntaxNode> children = argumentList.children();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode argument = children.get(i);
            Optional<String> keyword = Nodes.keywordName(argument);
            if (keyword.isEmpty() || !table.containsKey(keyword.get())) {
                continue;
            }
            String replacement = table.get(keyword.get());
            if (Nodes.keywordArgument(call, replacement).isPresent()) {
                context.manualReview("Both '" + keyword.get() + "' and '" + replacement + "' are passed to "
                        + lookup.get().key() + "; remove '" + keyword.get() + "' by hand", argument.line());
                continue;
            }
            updated = updated.withChild(i, argument.withChild(0, argument.child(0).withText(replacement)));
        }
        if (updated == argumentList) {
            return call;
        }
        if (lookup.get().isAmbiguous()) {
            context.report(DiagnosticKind.AMBIGUITY, Severity.INFO, "Applied keyword renames of '"
                    + lookup.get().key() + "'; also matched " + lookup.get().shadowed(), call.line());
        }
        return call.withChild(1, updated);
    }

    private Optional<NameTable.Lookup<Map<String, String>>> lookup(SyntaxNode call) {
        SyntaxNode callee = Nodes.callee(call);
        return Nodes.qualifiedName(callee)
                .or(() -> Nodes.simpleName(callee))
                .flatMap(renames::lookup);
    }
}
