package com.raditha.cocotb.engine;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.pass.PassContext;
import com.raditha.cocotb.pass.TransformationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a run changed anything, and finds what a run would act on without running it.
 */
public final class ChangeReporter {
    private static final Logger logger = LoggerFactory.getLogger(ChangeReporter.class);

    private static final int SNIPPET_LENGTH = 80;

    private ChangeReporter() {
        // Utility class
    }

    /**
     * A unit counts as changed exactly when the printed output differs from the input.
     */
    public static boolean decide(String original, String rewritten) {
        return !original.equals(rewritten);
    }

    /**
     * Asks every pass's {@link TransformationPass#wouldTouch} about every node of the unmodified
     * tree.
     *
     * @return detections ordered by line
     */
    public static List<Detection> scan(SyntaxNode tree, List<TransformationPass> passes) {
        List<Detection> detections = new ArrayList<>();
        for (TransformationPass pass : passes) {
            PassContext context = new PassContext(pass.getName());
            walk(tree, pass, pass.inspectedKinds(), context, detections);
        }
        detections.sort(Comparator.comparingInt(Detection::line));
        return detections;
    }

    private static void walk(SyntaxNode node, TransformationPass pass, Set<NodeKind> kinds, PassContext context,
            List<Detection> detections) {
        if (!node.isLeaf()) {
            context.enter(node);
            for (int i = 0; i < node.childCount(); i++) {
                context.atChild(i);
                walk(node.child(i), pass, kinds, context, detections);
            }
            context.leave();
        }
        if (!kinds.contains(node.kind())) {
            return;
        }
        try {
            if (pass.wouldTouch(node, context)) {
                detections.add(new Detection(pass.getName(), node.line(), snippet(node)));
            }
        } catch (RuntimeException e) {
            logger.warn("Pass {} failed to inspect {} at line {}", pass.getName(), node.kind(), node.line(), e);
        }
    }

    static String snippet(SyntaxNode node) {
        String text = node.toSource().strip();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline).stripTrailing() + " ...";
        }
        if (text.length() > SNIPPET_LENGTH) {
            text = text.substring(0, SNIPPET_LENGTH - 3) + "...";
        }
        return text;
    }
}
