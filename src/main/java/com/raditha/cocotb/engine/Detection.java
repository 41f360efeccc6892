package com.raditha.cocotb.engine;

/**
 * A place the pre-scan found that a pass would change or report.
 *
 * @param passName the pass that would act
 * @param line     1-based line of the node
 * @param snippet  the node's source text, trimmed and shortened to one line
 */
public record Detection(String passName, int line, String snippet) {

    @Override
    public String toString() {
        return "line " + line + " [" + passName + "] " + snippet;
    }
}
