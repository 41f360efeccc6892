package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.NameTable;
import com.raditha.cocotb.match.Patterns;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drops keyword arguments that no longer exist from method calls, e.g.
 * {@code clk.start(cycles=4)} to {@code clk.start()}. The separating comma goes with the
 * argument. Every removal changes behaviour, so each one is reported for manual review, and a
 * removal table entry that fired at least once adds its advisory comment to the top of the file.
 */
public class KeywordRemovalPass extends TransformationPass {
    public static final String NAME = "keyword-removal";

    private final NameTable<List<String>> removals;
    private final Map<String, String> advisories;

    /**
     * @param removals   method name to the keywords it no longer accepts
     * @param advisories method name to the comment inserted when one of its keywords is removed
     */
    public KeywordRemovalPass(NameTable<List<String>> removals, Map<String, String> advisories) {
        this.removals = removals;
        this.advisories = new LinkedHashMap<>(advisories);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 80;
    }

    @Override
    public String getDescription() {
        return "clk.start(cycles=...) -> clk.start() with a review warning";
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
        return lookup(node).filter(l -> Matcher.matches(node, Patterns.hasAnyKeyword(l.value()))).isPresent();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode call, PassContext context) {
        Optional<NameTable.Lookup<List<String>>> lookup = lookup(call);
        if (lookup.isEmpty()) {
            return call;
        }
        List<String> keywords = lookup.get().value();
        SyntaxNode argumentList = Nodes.argumentList(call);
        SyntaxNode updated = argumentList;
        int i = 0;
        while (i < updated.childCount()) {
            SyntaxNode argument = updated.child(i);
            Optional<String> keyword = Nodes.keywordName(argument).filter(keywords::contains);
            if (keyword.isEmpty()) {
                i++;
                continue;
            }
            context.manualReview("Removed '" + argument.toSource().strip() + "' from "
                    + Nodes.callee(call).toSource().strip() + "(): the argument no longer exists;"
                    + " check the intended behaviour", argument.line());
            context.markSeen(lookup.get().key());
            updated = Nodes.withoutArgument(updated, i);
            // the argument list shrank, so index i now holds the next element
            i = Math.max(0, i - 1);
        }
        return updated == argumentList ? call : call.withChild(1, updated);
    }

    @Override
    public SyntaxNode finish(SyntaxNode module, PassContext context) {
        for (String method : context.seen()) {
            String advisory = advisories.get(method);
            if (advisory != null) {
                context.requestAdvisory(advisory);
            }
        }
        return module;
    }

    private Optional<NameTable.Lookup<List<String>>> lookup(SyntaxNode call) {
        SyntaxNode callee = Nodes.callee(call);
        if (!callee.is(NodeKind.ATTRIBUTE)) {
            return Optional.empty();
        }
        return Nodes.qualifiedName(callee)
                .or(() -> Nodes.simpleName(callee))
                .flatMap(removals::lookup);
    }
}
