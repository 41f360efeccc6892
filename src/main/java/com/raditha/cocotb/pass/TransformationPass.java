package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Abstract base class for rewrite passes.
 *
 * <p>
 * Each pass handles one kind of legacy construct (a decorator, a call shape, a keyword
 * argument, ...). The runner walks the tree once per pass, children before parents, and calls
 * {@link #rewrite} for every node whose kind is listed in {@link #inspectedKinds()}.
 *
 * <p>
 * All passes share these rules:
 * <ul>
 * <li>A pass keeps no state between calls; per-traversal state goes into the
 * {@link PassContext}</li>
 * <li>Nodes are never modified; a rewrite returns a replacement or the node itself</li>
 * <li>Shapes a pass does not recognise are returned unchanged</li>
 * </ul>
 *
 * <p>
 * Instances are built once and may be shared by any number of concurrent runs.
 */
public abstract class TransformationPass {

    /**
     * Logger for pass operations.
     * Subclasses should use this instead of creating their own.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Get the name of this pass, as used in configuration and diagnostics.
     *
     * @return the pass name (e.g., "yield-to-await")
     */
    public abstract String getName();

    /**
     * Get the priority of this pass. Lower values run first when no explicit order is
     * configured.
     *
     * <p>
     * Typical priorities:
     * <ul>
     * <li>10-20: function-level changes (decorators, async)</li>
     * <li>30-40: statement and expression rewrites</li>
     * <li>50-80: call and argument rewrites</li>
     * <li>90-100: diagnostics and qualification</li>
     * </ul>
     *
     * @return the priority (default 100)
     */
    public int getPriority() {
        return 100;
    }

    /**
     * Kinds of node this pass wants to see.
     */
    public abstract Set<NodeKind> inspectedKinds();

    /**
     * Rewrites one node. Its children have already been visited by this pass.
     *
     * @param node    a node of one of the {@link #inspectedKinds()}
     * @param context state of the current traversal
     * @return the replacement, or {@code node} itself to decline
     */
    public abstract SyntaxNode rewrite(SyntaxNode node, PassContext context);

    /**
     * Detection-only counterpart of {@link #rewrite}: true when the pass would change or report
     * something for this node. Never modifies anything.
     */
    public abstract boolean wouldTouch(SyntaxNode node, PassContext context);

    /**
     * Called once with the rewritten module after the traversal.
     *
     * @return the module, possibly replaced
     */
    public SyntaxNode finish(SyntaxNode module, PassContext context) {
        return module;
    }

    /**
     * Short description of what the pass does, for reports and {@code --help} output.
     */
    public abstract String getDescription();

    @Override
    public String toString() {
        return getName();
    }
}
