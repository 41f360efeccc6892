package com.raditha.cocotb.engine;

import com.raditha.cocotb.cst.SyntaxNode;

import java.util.List;

/**
 * Outcome of running a pass list over one tree.
 *
 * @param tree        the rewritten tree
 * @param modified    true when at least one pass reported a rewrite
 * @param diagnostics findings in pass order, then visitation order
 */
public record PassRunResult(SyntaxNode tree, boolean modified, List<Diagnostic> diagnostics) {

    public PassRunResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
