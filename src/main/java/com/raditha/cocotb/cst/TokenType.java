package com.raditha.cocotb.cst;

/**
 * Token categories produced by {@link PythonLexer}. Keywords are {@link #NAME} tokens; the parser
 * decides from context whether a name is a keyword.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    /** End of a logical line. Empty text when the file ends without a line break. */
    NEWLINE,
    /** Zero-width. */
    INDENT,
    /** Zero-width. */
    DEDENT,
    /** Zero-width; owns the trivia after the last real token. */
    END_OF_FILE
}
