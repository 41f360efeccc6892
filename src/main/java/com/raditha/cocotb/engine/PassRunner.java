package com.raditha.cocotb.engine;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.pass.PassContext;
import com.raditha.cocotb.pass.TransformationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Applies an ordered list of passes to one tree.
 *
 * <p>
 * Each pass gets its own post-order traversal over the output of the previous pass, so a
 * parent is rewritten after its children and sees their replacements. A pass that throws on a
 * node does not stop the run: the node is kept as it was, a {@link DiagnosticKind#RULE_FAILURE}
 * is recorded and the traversal moves on.
 *
 * <p>
 * With {@code maxIterations > 1} the whole list is repeated while some pass still rewrites
 * something. Diagnostics of later rounds are only kept when they are new.
 */
public class PassRunner {
    private static final Logger logger = LoggerFactory.getLogger(PassRunner.class);

    public static final String RUNNER_NAME = "pass-runner";

    private final int maxIterations;

    public PassRunner() {
        this(1);
    }

    public PassRunner(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public PassRunResult run(SyntaxNode tree, List<TransformationPass> passes) {
        DiagnosticCollector collector = new DiagnosticCollector();
        SyntaxNode current = tree;
        boolean modified = false;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            DiagnosticCollector round = new DiagnosticCollector();
            boolean roundModified = false;
            for (TransformationPass pass : passes) {
                PassContext context = new PassContext(pass.getName(), round);
                current = runPass(current, pass, context);
                if (context.isModified()) {
                    logger.debug("Pass {} modified the tree in round {}", pass.getName(), iteration);
                    roundModified = true;
                }
            }
            if (iteration == 1) {
                collector.addAll(round.diagnostics());
            } else {
                collector.addAllNew(round.diagnostics());
            }
            modified |= roundModified;

            if (!roundModified) {
                break;
            }
            if (iteration == maxIterations && maxIterations > 1) {
                logger.warn("No fixed point after {} rounds", maxIterations);
                collector.report(RUNNER_NAME, DiagnosticKind.MANUAL_REVIEW, Severity.WARNING,
                        "Passes were still changing the file after " + maxIterations
                                + " rounds; the result may be incomplete", 0);
            }
        }
        return new PassRunResult(current, modified, collector.diagnostics());
    }

    private SyntaxNode runPass(SyntaxNode tree, TransformationPass pass, PassContext context) {
        Set<NodeKind> kinds = pass.inspectedKinds();
        SyntaxNode result = visit(tree, pass, kinds, context);

        try {
            SyntaxNode finished = pass.finish(result, context);
            if (finished == null) {
                throw new IllegalStateException("finish returned null");
            }
            if (finished != result) {
                context.markModified();
                result = finished;
            }
        } catch (RuntimeException e) {
            logger.warn("Pass {} failed to finish the module", pass.getName(), e);
            context.report(DiagnosticKind.RULE_FAILURE, Severity.ERROR,
                    "End-of-file step failed: " + e.getMessage(), 0);
        }

        List<String> advisories = context.advisories();
        if (!advisories.isEmpty()) {
            SyntaxNode annotated = context.getCollector().injectAdvisories(result, pass.getName(), advisories);
            if (annotated != result) {
                context.markModified();
                result = annotated;
            }
        }
        return result;
    }

    private SyntaxNode visit(SyntaxNode node, TransformationPass pass, Set<NodeKind> kinds, PassContext context) {
        SyntaxNode current = node;
        if (!node.isLeaf()) {
            List<SyntaxNode> children = null;
            context.enter(node);
            for (int i = 0; i < node.childCount(); i++) {
                context.atChild(i);
                SyntaxNode child = node.child(i);
                SyntaxNode rewritten = visit(child, pass, kinds, context);
                if (rewritten != child) {
                    if (children == null) {
                        children = new ArrayList<>(node.children());
                    }
                    children.set(i, rewritten);
                }
            }
            context.leave();
            if (children != null) {
                current = node.withChildren(children);
            }
        }
        if (!kinds.contains(current.kind())) {
            return current;
        }

        try {
            SyntaxNode replacement = pass.rewrite(current, context);
            if (replacement == null) {
                throw new IllegalStateException("rewrite returned null");
            }
            if (replacement != current) {
                logger.debug("{} rewrote {} at line {}", pass.getName(), current.kind(), current.line());
                context.markModified();
            }
            return replacement;
        } catch (RuntimeException e) {
            logger.warn("Pass {} failed on {} at line {}", pass.getName(), current.kind(), current.line(), e);
            context.report(DiagnosticKind.RULE_FAILURE, Severity.ERROR,
                    "Rule failed on " + current.kind() + ": " + e.getMessage(), current.line());
            return current;
        }
    }
}
