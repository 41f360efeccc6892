package com.raditha.cocotb.cst;

/**
 * The closed set of node kinds in the concrete syntax tree.
 *
 * <p>
 * Child layouts (token leaves included, in source order) for the kinds the rewrite passes rely
 * on:
 * <ul>
 * <li>{@link #NAME}: one NAME token</li>
 * <li>{@link #ATTRIBUTE}: value expression, {@code "."} token, NAME token</li>
 * <li>{@link #CALL}: callee expression, {@link #ARGUMENT_LIST}</li>
 * <li>{@link #ARGUMENT_LIST}: {@code "("}, arguments separated by {@code ","} tokens, {@code ")"}</li>
 * <li>{@link #ARGUMENT}: value; or NAME token, {@code "="}, value; or {@code "*"}/{@code "**"}, value</li>
 * <li>{@link #FUNCTION_DEF}: decorators, optional {@code async}, {@code def}, NAME token,
 * {@link #PARAMETERS}, optional {@code "->"} annotation, {@code ":"}, {@link #BLOCK}</li>
 * <li>{@link #DECORATOR}: {@code "@"}, expression, NEWLINE token</li>
 * <li>{@link #YIELD}: {@code yield}, optional {@code from}, optional value</li>
 * <li>{@link #RAISE}: {@code raise}, optional exception, optional {@code from} and cause</li>
 * <li>{@link #RETURN}: {@code return}, optional value</li>
 * </ul>
 */
public enum NodeKind {
    MODULE,
    /** Leaf wrapping a single {@link Token}. */
    TOKEN,

    SIMPLE_STATEMENT,
    EXPRESSION_STATEMENT,
    ASSIGNMENT,
    AUGMENTED_ASSIGNMENT,
    ANNOTATED_ASSIGNMENT,
    RETURN,
    RAISE,
    PASS,
    BREAK,
    CONTINUE,
    DELETE,
    GLOBAL,
    NONLOCAL,
    IMPORT,
    IMPORT_FROM,
    ASSERT,

    FUNCTION_DEF,
    CLASS_DEF,
    DECORATOR,
    PARAMETERS,
    PARAMETER,
    BLOCK,
    IF,
    ELIF_CLAUSE,
    ELSE_CLAUSE,
    WHILE,
    FOR,
    TRY,
    EXCEPT_CLAUSE,
    FINALLY_CLAUSE,
    WITH,
    WITH_ITEM,
    MATCH,
    CASE_CLAUSE,
    CASE_PATTERN,

    NAME,
    NUMBER,
    STRING,
    ELLIPSIS,
    ATTRIBUTE,
    CALL,
    ARGUMENT_LIST,
    ARGUMENT,
    SUBSCRIPT,
    SLICE,
    TUPLE,
    LIST,
    SET,
    DICT,
    DICT_ENTRY,
    PARENTHESIZED,
    COMPREHENSION,
    COMP_FOR,
    COMP_IF,
    BINARY_OPERATION,
    BOOLEAN_OPERATION,
    COMPARISON,
    UNARY_OPERATION,
    AWAIT,
    YIELD,
    LAMBDA,
    CONDITIONAL,
    STARRED,
    NAMED_EXPRESSION;

    public enum Category {
        ROOT,
        LEAF,
        STATEMENT,
        CLAUSE,
        EXPRESSION
    }

    public Category category() {
        return switch (this) {
            case MODULE -> Category.ROOT;
            case TOKEN -> Category.LEAF;
            case SIMPLE_STATEMENT, EXPRESSION_STATEMENT, ASSIGNMENT, AUGMENTED_ASSIGNMENT,
                    ANNOTATED_ASSIGNMENT, RETURN, RAISE, PASS, BREAK, CONTINUE, DELETE, GLOBAL,
                    NONLOCAL, IMPORT, IMPORT_FROM, ASSERT, FUNCTION_DEF, CLASS_DEF, IF, WHILE, FOR,
                    TRY, WITH, MATCH -> Category.STATEMENT;
            case DECORATOR, PARAMETERS, PARAMETER, BLOCK, ELIF_CLAUSE, ELSE_CLAUSE, EXCEPT_CLAUSE,
                    FINALLY_CLAUSE, WITH_ITEM, CASE_CLAUSE, CASE_PATTERN, ARGUMENT_LIST, ARGUMENT,
                    SLICE, DICT_ENTRY, COMP_FOR, COMP_IF -> Category.CLAUSE;
            case NAME, NUMBER, STRING, ELLIPSIS, ATTRIBUTE, CALL, SUBSCRIPT, TUPLE, LIST, SET, DICT,
                    PARENTHESIZED, COMPREHENSION, BINARY_OPERATION, BOOLEAN_OPERATION, COMPARISON,
                    UNARY_OPERATION, AWAIT, YIELD, LAMBDA, CONDITIONAL, STARRED,
                    NAMED_EXPRESSION -> Category.EXPRESSION;
        };
    }

    public boolean isStatement() {
        return category() == Category.STATEMENT;
    }

    public boolean isExpression() {
        return category() == Category.EXPRESSION;
    }
}
