package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxFactory;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.Severity;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Qualifies bare trigger calls: {@code RisingEdge(clk)} becomes
 * {@code cocotb.triggers.RisingEdge(clk)}.
 *
 * <p>
 * Only callees that are a plain name are considered, so a call that is already qualified is
 * never touched. When two configured names share the simple name, the first one declared wins
 * and an ambiguity is reported.
 */
public class QualifyNamesPass extends TransformationPass {
    public static final String NAME = "qualify-names";

    private final Map<String, List<String>> bySimpleName = new LinkedHashMap<>();
    private final Pattern bareCall;

    public QualifyNamesPass(List<String> qualifiedNames) {
        for (String qualified : qualifiedNames) {
            if (!qualified.contains(".")) {
                logger.warn("Ignoring '{}' in qualified_names: it has no module prefix", qualified);
                continue;
            }
            String simple = qualified.substring(qualified.lastIndexOf('.') + 1);
            bySimpleName.computeIfAbsent(simple, k -> new ArrayList<>()).add(qualified);
        }
        Pattern known = Patterns.anyOf(bySimpleName.keySet().stream()
                .map(Patterns::nameEndingWith)
                .toArray(Pattern[]::new));
        this.bareCall = Patterns.call(Patterns.kind(NodeKind.NAME).and(known));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 95;
    }

    @Override
    public String getDescription() {
        return "RisingEdge(clk) -> cocotb.triggers.RisingEdge(clk)";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return node.is(NodeKind.CALL) && !candidates(node).isEmpty();
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode call, PassContext context) {
        if (!wouldTouch(call, context)) {
            return call;
        }
        List<String> candidates = candidates(call);
        String qualified = candidates.get(0);
        if (candidates.size() > 1) {
            context.report(DiagnosticKind.AMBIGUITY, Severity.INFO, "'" + Nodes.callee(call).text()
                    + "' could be any of " + candidates + "; used " + qualified, call.line());
        }
        SyntaxNode callee = Nodes.callee(call);
        return call.withChild(0, SyntaxFactory.dottedName(qualified, callee.leadingTrivia()));
    }

    private List<String> candidates(SyntaxNode call) {
        if (!Matcher.matches(call, bareCall)) {
            return List.of();
        }
        return bySimpleName.get(Nodes.callee(call).text());
    }
}
