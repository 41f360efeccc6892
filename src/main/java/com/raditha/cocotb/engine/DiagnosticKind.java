package com.raditha.cocotb.engine;

/**
 * What a {@link Diagnostic} is about.
 */
public enum DiagnosticKind {
    /** A legacy construct was found that cannot be rewritten mechanically. */
    MANUAL_REVIEW,
    /** More than one rule matched a name; the highest-precedence one was applied. */
    AMBIGUITY,
    /** A rewrite threw; the node was left as it was. */
    RULE_FAILURE,
    /** A notice comment was inserted into the output. */
    ADVISORY
}
