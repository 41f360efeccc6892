package com.raditha.cocotb.cst;

/**
 * Thrown when source text is not valid Python. No partial tree is ever returned alongside it.
 */
public class ParseException extends Exception {
    private final String reason;
    private final SourcePosition position;

    public ParseException(String reason, SourcePosition position) {
        super(reason + " at " + position);
        this.reason = reason;
        this.position = position;
    }

    /**
     * The message without the position suffix.
     */
    public String getReason() {
        return reason;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public int getLine() {
        return position.line();
    }

    public int getColumn() {
        return position.column();
    }
}
