package com.raditha.cocotb.cst;

/**
 * A location in the original source text.
 *
 * @param line   1-based line number, 0 for synthetic tokens
 * @param column 1-based column number, 0 for synthetic tokens
 * @param offset 0-based character offset, -1 for synthetic tokens
 */
public record SourcePosition(int line, int column, int offset) {

    /**
     * Position carried by tokens created during a rewrite.
     */
    public static final SourcePosition SYNTHETIC = new SourcePosition(0, 0, -1);

    public boolean isSynthetic() {
        return offset < 0;
    }

    @Override
    public String toString() {
        return isSynthetic() ? "<synthetic>" : line + ":" + column;
    }
}
