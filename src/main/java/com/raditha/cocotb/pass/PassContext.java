package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.engine.DiagnosticCollector;
import com.raditha.cocotb.engine.DiagnosticKind;
import com.raditha.cocotb.engine.Severity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one traversal of one pass: the diagnostics it reported, whether it changed
 * anything, the chain of ancestors of the node being visited and the advisory notices it asked
 * for. A new context is created for every traversal and never shared between threads.
 */
public class PassContext {
    private final String passName;
    private final DiagnosticCollector collector;
    private final Deque<SyntaxNode> ancestors = new ArrayDeque<>();
    private final Deque<Integer> childIndexes = new ArrayDeque<>();
    private final Set<String> seen = new LinkedHashSet<>();
    private final Set<String> advisories = new LinkedHashSet<>();
    private boolean modified;

    public PassContext(String passName) {
        this(passName, new DiagnosticCollector());
    }

    public PassContext(String passName, DiagnosticCollector collector) {
        this.passName = passName;
        this.collector = collector;
    }

    public String getPassName() {
        return passName;
    }

    public DiagnosticCollector getCollector() {
        return collector;
    }

    public void markModified() {
        modified = true;
    }

    public boolean isModified() {
        return modified;
    }

    public void manualReview(String message, int line) {
        collector.manualReview(passName, message, line);
    }

    public void report(DiagnosticKind kind, Severity severity, String message, int line) {
        collector.report(passName, kind, severity, message, line);
    }

    public void enter(SyntaxNode node) {
        ancestors.push(node);
        childIndexes.push(-1);
    }

    /**
     * Records which child of the innermost ancestor is about to be visited.
     */
    public void atChild(int index) {
        childIndexes.pop();
        childIndexes.push(index);
    }

    public void leave() {
        ancestors.pop();
        childIndexes.pop();
    }

    /**
     * Position of the visited node among its parent's children, or -1 at the root.
     */
    public int indexInParent() {
        Integer index = childIndexes.peek();
        return index == null ? -1 : index;
    }

    /**
     * Ancestors of the node being visited, innermost first. These are the nodes as they were
     * before this traversal rewrote anything below them.
     */
    public List<SyntaxNode> ancestors() {
        return new ArrayList<>(ancestors);
    }

    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(ancestors.peek());
    }

    public Optional<SyntaxNode> nearest(NodeKind kind) {
        for (SyntaxNode ancestor : ancestors) {
            if (ancestor.is(kind)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /**
     * Records that something of the given kind was encountered during the traversal.
     *
     * @return true the first time a kind is marked
     */
    public boolean markSeen(String kind) {
        return seen.add(kind);
    }

    /**
     * Marked kinds in the order they were first seen.
     */
    public List<String> seen() {
        return new ArrayList<>(seen);
    }

    public boolean hasSeen(String kind) {
        return seen.contains(kind);
    }

    /**
     * Asks for a comment line at the top of the file once the traversal is over.
     */
    public void requestAdvisory(String notice) {
        advisories.add(notice);
    }

    public List<String> advisories() {
        return new ArrayList<>(advisories);
    }
}
