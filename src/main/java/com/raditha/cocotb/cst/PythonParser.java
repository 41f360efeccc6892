package com.raditha.cocotb.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Python 3 source producing a lossless {@link SyntaxNode} tree.
 *
 * <p>
 * Every token returned by {@link PythonLexer} ends up as exactly one leaf of the tree, so
 * printing the result gives back the input. The grammar covers statements and expressions as
 * written in test benches and libraries; {@code match} case patterns are kept as a flat run of
 * tokens since no rewrite looks inside them.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SyntaxNode module = PythonParser.parse(text);
 * assert SourcePrinter.print(module).equals(text);
 * </pre>
 */
public class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> CONSTANTS = Set.of("True", "False", "None");

    private static final Set<String> AUGMENTED_OPERATORS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**=");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> EXPRESSION_START_OPERATORS = Set.of(
            "(", "[", "{", "-", "+", "~", "*", "...");

    @FunctionalInterface
    private interface ParseStep {
        SyntaxNode parse() throws ParseException;
    }

    private static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private int current = 0;
    private int nesting = 0;

    public PythonParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete source file.
     *
     * @param source the Python source text
     * @return the {@link NodeKind#MODULE} root
     * @throws ParseException when the text is not valid Python
     */
    public static SyntaxNode parse(String source) throws ParseException {
        return new PythonParser(new PythonLexer(source).tokenize()).parseModule();
    }

    public SyntaxNode parseModule() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        while (!check(TokenType.END_OF_FILE)) {
            children.add(parseStatement());
        }
        children.add(advance());
        return SyntaxNode.of(NodeKind.MODULE, children);
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private SyntaxNode parseStatement() throws ParseException {
        if (check(TokenType.INDENT)) {
            throw error("unexpected indent");
        }
        if (checkOp("@")) {
            return parseDecorated();
        }
        if (check(TokenType.NAME)) {
            switch (peek().text()) {
                case "def":
                    return parseFunctionDef(new ArrayList<>(), null);
                case "class":
                    return parseClassDef(new ArrayList<>());
                case "if":
                    return parseIf();
                case "while":
                    return parseWhile();
                case "for":
                    return parseFor(null);
                case "try":
                    return parseTry();
                case "with":
                    return parseWith(null);
                case "async":
                    if (peekAt(1).isName("def")) {
                        SyntaxNode asyncLeaf = advance();
                        return parseFunctionDef(new ArrayList<>(), asyncLeaf);
                    }
                    if (peekAt(1).isName("for")) {
                        return parseFor(advance());
                    }
                    if (peekAt(1).isName("with")) {
                        return parseWith(advance());
                    }
                    break;
                case "match":
                    if (isMatchStatement()) {
                        return parseMatch();
                    }
                    break;
                default:
                    break;
            }
        }
        return parseSimpleStatement();
    }

    private SyntaxNode parseDecorated() throws ParseException {
        List<SyntaxNode> decorators = new ArrayList<>();
        while (checkOp("@")) {
            SyntaxNode at = advance();
            SyntaxNode expression = parseNamedExpression();
            SyntaxNode newline = expect(TokenType.NEWLINE, "invalid syntax");
            decorators.add(SyntaxNode.of(NodeKind.DECORATOR, at, expression, newline));
        }
        if (checkKeyword("def")) {
            return parseFunctionDef(decorators, null);
        }
        if (checkKeyword("async") && peekAt(1).isName("def")) {
            SyntaxNode asyncLeaf = advance();
            return parseFunctionDef(decorators, asyncLeaf);
        }
        if (checkKeyword("class")) {
            return parseClassDef(decorators);
        }
        throw error("expected function or class definition after decorator");
    }

    private SyntaxNode parseFunctionDef(List<SyntaxNode> decorators, SyntaxNode asyncLeaf) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>(decorators);
        if (asyncLeaf != null) {
            children.add(asyncLeaf);
        }
        children.add(expectKeyword("def"));
        children.add(expectName());
        List<SyntaxNode> parameters = new ArrayList<>();
        parameters.add(expectOp("("));
        parameters.addAll(parseParameterItems(true, ")"));
        parameters.add(expectOp(")"));
        children.add(SyntaxNode.of(NodeKind.PARAMETERS, parameters));
        if (checkOp("->")) {
            children.add(advance());
            children.add(parseExpression());
        }
        children.add(expectOp(":"));
        children.add(parseBlock());
        return SyntaxNode.of(NodeKind.FUNCTION_DEF, children);
    }

    private SyntaxNode parseClassDef(List<SyntaxNode> decorators) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>(decorators);
        children.add(expectKeyword("class"));
        children.add(expectName());
        if (checkOp("(")) {
            children.add(parseArgumentList());
        }
        children.add(expectOp(":"));
        children.add(parseBlock());
        return SyntaxNode.of(NodeKind.CLASS_DEF, children);
    }

    private SyntaxNode parseIf() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(parseNamedExpression());
        children.add(expectOp(":"));
        children.add(parseBlock());
        while (checkKeyword("elif")) {
            SyntaxNode elif = advance();
            SyntaxNode condition = parseNamedExpression();
            SyntaxNode colon = expectOp(":");
            children.add(SyntaxNode.of(NodeKind.ELIF_CLAUSE, elif, condition, colon, parseBlock()));
        }
        if (checkKeyword("else")) {
            children.add(parseElse());
        }
        return SyntaxNode.of(NodeKind.IF, children);
    }

    private SyntaxNode parseElse() throws ParseException {
        SyntaxNode elseLeaf = advance();
        SyntaxNode colon = expectOp(":");
        return SyntaxNode.of(NodeKind.ELSE_CLAUSE, elseLeaf, colon, parseBlock());
    }

    private SyntaxNode parseWhile() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(parseNamedExpression());
        children.add(expectOp(":"));
        children.add(parseBlock());
        if (checkKeyword("else")) {
            children.add(parseElse());
        }
        return SyntaxNode.of(NodeKind.WHILE, children);
    }

    private SyntaxNode parseFor(SyntaxNode asyncLeaf) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        if (asyncLeaf != null) {
            children.add(asyncLeaf);
        }
        children.add(expectKeyword("for"));
        children.add(parseTargetList());
        children.add(expectKeyword("in"));
        children.add(parseStarExpressions());
        children.add(expectOp(":"));
        children.add(parseBlock());
        if (checkKeyword("else")) {
            children.add(parseElse());
        }
        return SyntaxNode.of(NodeKind.FOR, children);
    }

    private SyntaxNode parseTry() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(expectOp(":"));
        children.add(parseBlock());
        boolean handled = false;
        while (checkKeyword("except")) {
            List<SyntaxNode> clause = new ArrayList<>();
            clause.add(advance());
            if (checkOp("*")) {
                clause.add(advance());
            }
            if (!checkOp(":")) {
                clause.add(parseExpression());
                if (checkKeyword("as")) {
                    clause.add(advance());
                    clause.add(expectName());
                }
            }
            clause.add(expectOp(":"));
            clause.add(parseBlock());
            children.add(SyntaxNode.of(NodeKind.EXCEPT_CLAUSE, clause));
            handled = true;
        }
        if (handled && checkKeyword("else")) {
            children.add(parseElse());
        }
        if (checkKeyword("finally")) {
            SyntaxNode finallyLeaf = advance();
            SyntaxNode colon = expectOp(":");
            children.add(SyntaxNode.of(NodeKind.FINALLY_CLAUSE, finallyLeaf, colon, parseBlock()));
            handled = true;
        }
        if (!handled) {
            throw error("expected 'except' or 'finally' block");
        }
        return SyntaxNode.of(NodeKind.TRY, children);
    }

    private SyntaxNode parseWith(SyntaxNode asyncLeaf) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        if (asyncLeaf != null) {
            children.add(asyncLeaf);
        }
        children.add(expectKeyword("with"));
        List<SyntaxNode> parenthesized = checkOp("(") ? tryParenthesizedWithItems() : null;
        if (parenthesized != null) {
            children.addAll(parenthesized);
        } else {
            children.add(parseWithItem());
            while (checkOp(",")) {
                children.add(advance());
                children.add(parseWithItem());
            }
        }
        children.add(expectOp(":"));
        children.add(parseBlock());
        return SyntaxNode.of(NodeKind.WITH, children);
    }

    /**
     * {@code with (a as b, c as d):} is ambiguous with a parenthesised expression; the items
     * form only applies when the closing parenthesis is directly followed by the colon.
     */
    private List<SyntaxNode> tryParenthesizedWithItems() {
        int mark = current;
        try {
            List<SyntaxNode> items = new ArrayList<>();
            items.add(advance());
            items.add(parseWithItem());
            while (checkOp(",")) {
                items.add(advance());
                if (checkOp(")")) {
                    break;
                }
                items.add(parseWithItem());
            }
            items.add(expectOp(")"));
            if (!checkOp(":")) {
                current = mark;
                return null;
            }
            return items;
        } catch (ParseException e) {
            current = mark;
            return null;
        }
    }

    private SyntaxNode parseWithItem() throws ParseException {
        SyntaxNode expression = parseExpression();
        if (checkKeyword("as")) {
            SyntaxNode as = advance();
            return SyntaxNode.of(NodeKind.WITH_ITEM, expression, as, parseTarget());
        }
        return SyntaxNode.of(NodeKind.WITH_ITEM, expression);
    }

    private boolean isMatchStatement() {
        Token next = peekAt(1);
        if (next.type() == TokenType.NEWLINE || next.isOperator("=") || next.isOperator(".")
                || next.isOperator(":") || AUGMENTED_OPERATORS.contains(next.text())) {
            return false;
        }
        int i = current + 1;
        while (tokens.get(i).type() != TokenType.NEWLINE && tokens.get(i).type() != TokenType.END_OF_FILE) {
            i++;
        }
        return tokens.get(i - 1).isOperator(":");
    }

    private SyntaxNode parseMatch() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(parseStarExpressions());
        children.add(expectOp(":"));
        children.add(expect(TokenType.NEWLINE, "expected newline after match subject"));
        children.add(expect(TokenType.INDENT, "expected an indented block"));
        do {
            children.add(parseCaseClause());
        } while (!check(TokenType.DEDENT));
        children.add(advance());
        return SyntaxNode.of(NodeKind.MATCH, children);
    }

    private SyntaxNode parseCaseClause() throws ParseException {
        if (!checkKeyword("case")) {
            throw error("expected 'case' block");
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        List<SyntaxNode> pattern = new ArrayList<>();
        int depth = 0;
        while (depth > 0 || !(checkOp(":") || checkKeyword("if"))) {
            if (check(TokenType.NEWLINE) || check(TokenType.END_OF_FILE)) {
                throw error("invalid case pattern");
            }
            Token token = peek();
            if (token.isOperator("(") || token.isOperator("[") || token.isOperator("{")) {
                depth++;
            } else if (token.isOperator(")") || token.isOperator("]") || token.isOperator("}")) {
                depth--;
            }
            pattern.add(advance());
        }
        if (pattern.isEmpty()) {
            throw error("invalid case pattern");
        }
        children.add(SyntaxNode.of(NodeKind.CASE_PATTERN, pattern));
        if (checkKeyword("if")) {
            children.add(advance());
            children.add(parseNamedExpression());
        }
        children.add(expectOp(":"));
        children.add(parseBlock());
        return SyntaxNode.of(NodeKind.CASE_CLAUSE, children);
    }

    private SyntaxNode parseBlock() throws ParseException {
        if (!check(TokenType.NEWLINE)) {
            return SyntaxNode.of(NodeKind.BLOCK, parseSimpleStatement());
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(expect(TokenType.INDENT, "expected an indented block"));
        do {
            children.add(parseStatement());
        } while (!check(TokenType.DEDENT));
        children.add(advance());
        return SyntaxNode.of(NodeKind.BLOCK, children);
    }

    private SyntaxNode parseSimpleStatement() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(parseSmallStatement());
        while (checkOp(";")) {
            children.add(advance());
            if (check(TokenType.NEWLINE)) {
                break;
            }
            children.add(parseSmallStatement());
        }
        children.add(expect(TokenType.NEWLINE, "invalid syntax"));
        return SyntaxNode.of(NodeKind.SIMPLE_STATEMENT, children);
    }

    private SyntaxNode parseSmallStatement() throws ParseException {
        if (check(TokenType.NAME)) {
            switch (peek().text()) {
                case "pass":
                    return SyntaxNode.of(NodeKind.PASS, advance());
                case "break":
                    return SyntaxNode.of(NodeKind.BREAK, advance());
                case "continue":
                    return SyntaxNode.of(NodeKind.CONTINUE, advance());
                case "return":
                    return parseReturn();
                case "raise":
                    return parseRaise();
                case "global":
                    return parseNameList(NodeKind.GLOBAL);
                case "nonlocal":
                    return parseNameList(NodeKind.NONLOCAL);
                case "del":
                    return SyntaxNode.of(NodeKind.DELETE, advance(), parseStarExpressions());
                case "import":
                    return parseImport();
                case "from":
                    return parseImportFrom();
                case "assert":
                    return parseAssert();
                default:
                    break;
            }
        }
        return parseExpressionOrAssignment();
    }

    private SyntaxNode parseReturn() throws ParseException {
        SyntaxNode keyword = advance();
        if (startsExpression(peek())) {
            return SyntaxNode.of(NodeKind.RETURN, keyword, parseStarExpressions());
        }
        return SyntaxNode.of(NodeKind.RETURN, keyword);
    }

    private SyntaxNode parseRaise() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        if (startsExpression(peek())) {
            children.add(parseExpression());
            if (checkKeyword("from")) {
                children.add(advance());
                children.add(parseExpression());
            }
        }
        return SyntaxNode.of(NodeKind.RAISE, children);
    }

    private SyntaxNode parseNameList(NodeKind kind) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(expectName());
        while (checkOp(",")) {
            children.add(advance());
            children.add(expectName());
        }
        return SyntaxNode.of(kind, children);
    }

    private SyntaxNode parseAssert() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        children.add(parseExpression());
        if (checkOp(",")) {
            children.add(advance());
            children.add(parseExpression());
        }
        return SyntaxNode.of(NodeKind.ASSERT, children);
    }

    private SyntaxNode parseImport() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        parseDottedAsName(children);
        while (checkOp(",")) {
            children.add(advance());
            parseDottedAsName(children);
        }
        return SyntaxNode.of(NodeKind.IMPORT, children);
    }

    private void parseDottedAsName(List<SyntaxNode> into) throws ParseException {
        parseDottedName(into);
        if (checkKeyword("as")) {
            into.add(advance());
            into.add(expectName());
        }
    }

    private void parseDottedName(List<SyntaxNode> into) throws ParseException {
        into.add(expectName());
        while (checkOp(".")) {
            into.add(advance());
            into.add(expectName());
        }
    }

    private SyntaxNode parseImportFrom() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        boolean relative = false;
        while (checkOp(".") || checkOp("...")) {
            children.add(advance());
            relative = true;
        }
        if (!checkKeyword("import")) {
            parseDottedName(children);
        } else if (!relative) {
            throw error("invalid syntax");
        }
        children.add(expectKeyword("import"));
        if (checkOp("*")) {
            children.add(advance());
        } else if (checkOp("(")) {
            children.add(advance());
            parseImportAsNames(children);
            children.add(expectOp(")"));
        } else {
            parseImportAsNames(children);
        }
        return SyntaxNode.of(NodeKind.IMPORT_FROM, children);
    }

    private void parseImportAsNames(List<SyntaxNode> into) throws ParseException {
        into.add(expectName());
        if (checkKeyword("as")) {
            into.add(advance());
            into.add(expectName());
        }
        while (checkOp(",")) {
            into.add(advance());
            if (checkOp(")")) {
                return;
            }
            into.add(expectName());
            if (checkKeyword("as")) {
                into.add(advance());
                into.add(expectName());
            }
        }
    }

    private SyntaxNode parseExpressionOrAssignment() throws ParseException {
        SyntaxNode first = checkKeyword("yield") ? parseYield() : parseStarExpressions();
        if (checkOp("=")) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(first);
            while (checkOp("=")) {
                children.add(advance());
                children.add(checkKeyword("yield") ? parseYield() : parseStarExpressions());
            }
            return SyntaxNode.of(NodeKind.ASSIGNMENT, children);
        }
        if (check(TokenType.OPERATOR) && AUGMENTED_OPERATORS.contains(peek().text())) {
            SyntaxNode operator = advance();
            SyntaxNode value = checkKeyword("yield") ? parseYield() : parseStarExpressions();
            return SyntaxNode.of(NodeKind.AUGMENTED_ASSIGNMENT, first, operator, value);
        }
        if (checkOp(":")) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(first);
            children.add(advance());
            children.add(parseExpression());
            if (checkOp("=")) {
                children.add(advance());
                children.add(checkKeyword("yield") ? parseYield() : parseStarExpressions());
            }
            return SyntaxNode.of(NodeKind.ANNOTATED_ASSIGNMENT, children);
        }
        return SyntaxNode.of(NodeKind.EXPRESSION_STATEMENT, first);
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private SyntaxNode parseStarExpressions() throws ParseException {
        SyntaxNode first = parseStarOrExpression();
        if (!checkOp(",")) {
            return first;
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        while (checkOp(",")) {
            children.add(advance());
            if (!startsExpression(peek())) {
                break;
            }
            children.add(parseStarOrExpression());
        }
        return SyntaxNode.of(NodeKind.TUPLE, children);
    }

    private SyntaxNode parseStarOrExpression() throws ParseException {
        if (checkOp("*")) {
            SyntaxNode star = advance();
            return SyntaxNode.of(NodeKind.STARRED, star, parseBitwiseOr());
        }
        return parseExpression();
    }

    private SyntaxNode parseStarOrNamed() throws ParseException {
        if (checkOp("*")) {
            SyntaxNode star = advance();
            return SyntaxNode.of(NodeKind.STARRED, star, parseBitwiseOr());
        }
        return parseNamedExpression();
    }

    private SyntaxNode parseNamedExpression() throws ParseException {
        if (check(TokenType.NAME) && peekAt(1).isOperator(":=") && !KEYWORDS.contains(peek().text())) {
            SyntaxNode target = SyntaxNode.of(NodeKind.NAME, advance());
            SyntaxNode walrus = advance();
            return SyntaxNode.of(NodeKind.NAMED_EXPRESSION, target, walrus, parseExpression());
        }
        return parseExpression();
    }

    private SyntaxNode parseExpression() throws ParseException {
        if (checkKeyword("lambda")) {
            return parseLambda();
        }
        SyntaxNode body = parseDisjunction();
        if (checkKeyword("if")) {
            SyntaxNode ifLeaf = advance();
            SyntaxNode condition = parseDisjunction();
            SyntaxNode elseLeaf = expectKeyword("else");
            return SyntaxNode.of(NodeKind.CONDITIONAL, body, ifLeaf, condition, elseLeaf, parseExpression());
        }
        return body;
    }

    private SyntaxNode parseLambda() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(advance());
        if (!checkOp(":")) {
            children.add(SyntaxNode.of(NodeKind.PARAMETERS, parseParameterItems(false, ":")));
        }
        children.add(expectOp(":"));
        children.add(parseExpression());
        return SyntaxNode.of(NodeKind.LAMBDA, children);
    }

    private SyntaxNode parseDisjunction() throws ParseException {
        return parseBooleanChain("or", this::parseConjunction);
    }

    private SyntaxNode parseConjunction() throws ParseException {
        return parseBooleanChain("and", this::parseInversion);
    }

    private SyntaxNode parseBooleanChain(String keyword, ParseStep operand) throws ParseException {
        SyntaxNode first = operand.parse();
        if (!checkKeyword(keyword)) {
            return first;
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        while (checkKeyword(keyword)) {
            children.add(advance());
            children.add(operand.parse());
        }
        return SyntaxNode.of(NodeKind.BOOLEAN_OPERATION, children);
    }

    private SyntaxNode parseInversion() throws ParseException {
        if (checkKeyword("not")) {
            SyntaxNode not = advance();
            return SyntaxNode.of(NodeKind.UNARY_OPERATION, not, parseInversion());
        }
        return parseComparison();
    }

    private SyntaxNode parseComparison() throws ParseException {
        SyntaxNode first = parseBitwiseOr();
        if (!atComparisonOperator()) {
            return first;
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        while (atComparisonOperator()) {
            if (checkKeyword("not") || checkKeyword("is")) {
                boolean isOperator = checkKeyword("is");
                children.add(advance());
                if (isOperator ? checkKeyword("not") : checkKeyword("in")) {
                    children.add(advance());
                }
            } else {
                children.add(advance());
            }
            children.add(parseBitwiseOr());
        }
        return SyntaxNode.of(NodeKind.COMPARISON, children);
    }

    private boolean atComparisonOperator() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR) {
            return COMPARISON_OPERATORS.contains(token.text());
        }
        return token.isName("in") || token.isName("is") || (token.isName("not") && peekAt(1).isName("in"));
    }

    private SyntaxNode parseBitwiseOr() throws ParseException {
        return parseBinary(this::parseBitwiseXor, "|");
    }

    private SyntaxNode parseBitwiseXor() throws ParseException {
        return parseBinary(this::parseBitwiseAnd, "^");
    }

    private SyntaxNode parseBitwiseAnd() throws ParseException {
        return parseBinary(this::parseShift, "&");
    }

    private SyntaxNode parseShift() throws ParseException {
        return parseBinary(this::parseSum, "<<", ">>");
    }

    private SyntaxNode parseSum() throws ParseException {
        return parseBinary(this::parseTerm, "+", "-");
    }

    private SyntaxNode parseTerm() throws ParseException {
        return parseBinary(this::parseFactor, "*", "/", "//", "%", "@");
    }

    /**
     * Parses a left-associative chain of one precedence level into a single flat
     * {@link NodeKind#BINARY_OPERATION} of alternating operands and operators.
     */
    private SyntaxNode parseBinary(ParseStep operand, String... operators) throws ParseException {
        SyntaxNode first = operand.parse();
        if (!checkAnyOp(operators)) {
            return first;
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        while (checkAnyOp(operators)) {
            children.add(advance());
            children.add(operand.parse());
        }
        return SyntaxNode.of(NodeKind.BINARY_OPERATION, children);
    }

    private SyntaxNode parseFactor() throws ParseException {
        if (checkAnyOp("+", "-", "~")) {
            SyntaxNode operator = advance();
            return SyntaxNode.of(NodeKind.UNARY_OPERATION, operator, parseFactor());
        }
        return parsePower();
    }

    private SyntaxNode parsePower() throws ParseException {
        SyntaxNode base = parseAwaitPrimary();
        if (checkOp("**")) {
            SyntaxNode operator = advance();
            return SyntaxNode.of(NodeKind.BINARY_OPERATION, base, operator, parseFactor());
        }
        return base;
    }

    private SyntaxNode parseAwaitPrimary() throws ParseException {
        if (checkKeyword("await")) {
            SyntaxNode await = advance();
            return SyntaxNode.of(NodeKind.AWAIT, await, parsePrimary());
        }
        return parsePrimary();
    }

    private SyntaxNode parsePrimary() throws ParseException {
        SyntaxNode node = parseAtom();
        while (true) {
            if (checkOp(".")) {
                SyntaxNode dot = advance();
                node = SyntaxNode.of(NodeKind.ATTRIBUTE, node, dot, expectName());
            } else if (checkOp("(")) {
                node = SyntaxNode.of(NodeKind.CALL, node, nested(this::parseArgumentList));
            } else if (checkOp("[")) {
                SyntaxNode value = node;
                node = nested(() -> parseSubscript(value));
            } else {
                return node;
            }
        }
    }

    private SyntaxNode parseSubscript(SyntaxNode value) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(value);
        children.add(advance());
        children.add(parseSliceItem());
        while (checkOp(",")) {
            children.add(advance());
            if (checkOp("]")) {
                break;
            }
            children.add(parseSliceItem());
        }
        children.add(expectOp("]"));
        return SyntaxNode.of(NodeKind.SUBSCRIPT, children);
    }

    private SyntaxNode parseSliceItem() throws ParseException {
        SyntaxNode lower = null;
        if (!checkOp(":")) {
            lower = parseStarOrNamed();
            if (!checkOp(":")) {
                return lower;
            }
        }
        List<SyntaxNode> children = new ArrayList<>();
        if (lower != null) {
            children.add(lower);
        }
        children.add(advance());
        if (!checkAnyOp(":", "]", ",")) {
            children.add(parseExpression());
        }
        if (checkOp(":")) {
            children.add(advance());
            if (!checkAnyOp("]", ",")) {
                children.add(parseExpression());
            }
        }
        return SyntaxNode.of(NodeKind.SLICE, children);
    }

    private SyntaxNode parseArgumentList() throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(expectOp("("));
        while (!checkOp(")")) {
            children.add(parseArgument());
            if (!checkOp(",")) {
                break;
            }
            children.add(advance());
        }
        children.add(expectOp(")"));
        return SyntaxNode.of(NodeKind.ARGUMENT_LIST, children);
    }

    private SyntaxNode parseArgument() throws ParseException {
        if (checkAnyOp("*", "**")) {
            SyntaxNode star = advance();
            return SyntaxNode.of(NodeKind.ARGUMENT, star, parseExpression());
        }
        if (check(TokenType.NAME) && peekAt(1).isOperator("=") && !KEYWORDS.contains(peek().text())) {
            SyntaxNode keyword = advance();
            SyntaxNode equals = advance();
            return SyntaxNode.of(NodeKind.ARGUMENT, keyword, equals, parseExpression());
        }
        SyntaxNode value = parseNamedExpression();
        if (atComprehensionClause()) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(value);
            children.addAll(parseComprehensionClauses());
            return SyntaxNode.of(NodeKind.ARGUMENT, children);
        }
        return SyntaxNode.of(NodeKind.ARGUMENT, value);
    }

    private List<SyntaxNode> parseParameterItems(boolean allowAnnotations, String closing) throws ParseException {
        List<SyntaxNode> items = new ArrayList<>();
        while (!checkOp(closing)) {
            items.add(parseParameter(allowAnnotations, closing));
            if (!checkOp(",")) {
                break;
            }
            items.add(advance());
        }
        return items;
    }

    private SyntaxNode parseParameter(boolean allowAnnotations, String closing) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        if (checkOp("/")) {
            return SyntaxNode.of(NodeKind.PARAMETER, advance());
        }
        if (checkAnyOp("*", "**")) {
            boolean single = checkOp("*");
            children.add(advance());
            if (single && (checkOp(",") || checkOp(closing))) {
                return SyntaxNode.of(NodeKind.PARAMETER, children);
            }
        }
        children.add(expectName());
        if (allowAnnotations && checkOp(":")) {
            children.add(advance());
            children.add(checkOp("*") ? parseStarOrExpression() : parseExpression());
        }
        if (checkOp("=")) {
            children.add(advance());
            children.add(parseExpression());
        }
        return SyntaxNode.of(NodeKind.PARAMETER, children);
    }

    private SyntaxNode parseYield() throws ParseException {
        SyntaxNode yield = advance();
        if (checkKeyword("from")) {
            SyntaxNode from = advance();
            return SyntaxNode.of(NodeKind.YIELD, yield, from, parseExpression());
        }
        if (startsExpression(peek())) {
            return SyntaxNode.of(NodeKind.YIELD, yield, parseStarExpressions());
        }
        return SyntaxNode.of(NodeKind.YIELD, yield);
    }

    private SyntaxNode parseAtom() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case NAME:
                if (KEYWORDS.contains(token.text()) && !CONSTANTS.contains(token.text())) {
                    throw error("invalid syntax");
                }
                return SyntaxNode.of(NodeKind.NAME, advance());
            case NUMBER:
                return SyntaxNode.of(NodeKind.NUMBER, advance());
            case STRING: {
                List<SyntaxNode> parts = new ArrayList<>();
                while (check(TokenType.STRING)) {
                    parts.add(advance());
                }
                return SyntaxNode.of(NodeKind.STRING, parts);
            }
            case OPERATOR:
                switch (token.text()) {
                    case "(":
                        return nested(this::parseParenthesized);
                    case "[":
                        return nested(this::parseListDisplay);
                    case "{":
                        return nested(this::parseBraceDisplay);
                    case "...":
                        return SyntaxNode.of(NodeKind.ELLIPSIS, advance());
                    default:
                        throw error("invalid syntax");
                }
            case INDENT:
                throw error("unexpected indent");
            default:
                throw error("invalid syntax");
        }
    }

    private SyntaxNode parseParenthesized() throws ParseException {
        SyntaxNode open = advance();
        if (checkOp(")")) {
            return SyntaxNode.of(NodeKind.TUPLE, open, advance());
        }
        if (checkKeyword("yield")) {
            SyntaxNode yield = parseYield();
            return SyntaxNode.of(NodeKind.PARENTHESIZED, open, yield, expectOp(")"));
        }
        SyntaxNode first = parseStarOrNamed();
        if (atComprehensionClause()) {
            return parseComprehension(open, first, ")");
        }
        if (checkOp(")")) {
            return SyntaxNode.of(NodeKind.PARENTHESIZED, open, first, advance());
        }
        return parseSequenceRest(NodeKind.TUPLE, open, first, ")");
    }

    private SyntaxNode parseListDisplay() throws ParseException {
        SyntaxNode open = advance();
        if (checkOp("]")) {
            return SyntaxNode.of(NodeKind.LIST, open, advance());
        }
        SyntaxNode first = parseStarOrNamed();
        if (atComprehensionClause()) {
            return parseComprehension(open, first, "]");
        }
        return parseSequenceRest(NodeKind.LIST, open, first, "]");
    }

    private SyntaxNode parseBraceDisplay() throws ParseException {
        SyntaxNode open = advance();
        if (checkOp("}")) {
            return SyntaxNode.of(NodeKind.DICT, open, advance());
        }
        SyntaxNode first = parseDictOrSetItem();
        boolean isDict = first.is(NodeKind.DICT_ENTRY);
        if (atComprehensionClause()) {
            return parseComprehension(open, first, "}");
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(open);
        children.add(first);
        while (checkOp(",")) {
            children.add(advance());
            if (checkOp("}")) {
                break;
            }
            SyntaxNode item = parseDictOrSetItem();
            if (item.is(NodeKind.DICT_ENTRY) != isDict) {
                throw error("invalid syntax");
            }
            children.add(item);
        }
        children.add(expectOp("}"));
        return SyntaxNode.of(isDict ? NodeKind.DICT : NodeKind.SET, children);
    }

    private SyntaxNode parseDictOrSetItem() throws ParseException {
        if (checkOp("**")) {
            SyntaxNode stars = advance();
            return SyntaxNode.of(NodeKind.DICT_ENTRY, stars, parseBitwiseOr());
        }
        if (checkOp("*")) {
            return parseStarOrNamed();
        }
        SyntaxNode key = parseNamedExpression();
        if (checkOp(":")) {
            SyntaxNode colon = advance();
            return SyntaxNode.of(NodeKind.DICT_ENTRY, key, colon, parseExpression());
        }
        return key;
    }

    private SyntaxNode parseSequenceRest(NodeKind kind, SyntaxNode open, SyntaxNode first, String closing)
            throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(open);
        children.add(first);
        while (checkOp(",")) {
            children.add(advance());
            if (checkOp(closing)) {
                break;
            }
            children.add(parseStarOrNamed());
        }
        children.add(expectOp(closing));
        return SyntaxNode.of(kind, children);
    }

    private SyntaxNode parseComprehension(SyntaxNode open, SyntaxNode element, String closing) throws ParseException {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(open);
        children.add(element);
        children.addAll(parseComprehensionClauses());
        children.add(expectOp(closing));
        return SyntaxNode.of(NodeKind.COMPREHENSION, children);
    }

    private boolean atComprehensionClause() {
        return checkKeyword("for") || (checkKeyword("async") && peekAt(1).isName("for"));
    }

    private List<SyntaxNode> parseComprehensionClauses() throws ParseException {
        List<SyntaxNode> clauses = new ArrayList<>();
        while (atComprehensionClause()) {
            List<SyntaxNode> children = new ArrayList<>();
            if (checkKeyword("async")) {
                children.add(advance());
            }
            children.add(advance());
            children.add(parseTargetList());
            children.add(expectKeyword("in"));
            children.add(parseDisjunction());
            clauses.add(SyntaxNode.of(NodeKind.COMP_FOR, children));
            while (checkKeyword("if")) {
                SyntaxNode ifLeaf = advance();
                clauses.add(SyntaxNode.of(NodeKind.COMP_IF, ifLeaf, parseDisjunction()));
            }
        }
        return clauses;
    }

    private SyntaxNode parseTargetList() throws ParseException {
        SyntaxNode first = parseTarget();
        if (!checkOp(",")) {
            return first;
        }
        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        while (checkOp(",")) {
            children.add(advance());
            if (!startsExpression(peek())) {
                break;
            }
            children.add(parseTarget());
        }
        return SyntaxNode.of(NodeKind.TUPLE, children);
    }

    private SyntaxNode parseTarget() throws ParseException {
        if (checkOp("*")) {
            SyntaxNode star = advance();
            return SyntaxNode.of(NodeKind.STARRED, star, parseBitwiseOr());
        }
        return parseBitwiseOr();
    }

    private static boolean startsExpression(Token token) {
        return switch (token.type()) {
            case NAME -> !KEYWORDS.contains(token.text()) || CONSTANTS.contains(token.text())
                    || token.text().equals("not") || token.text().equals("lambda")
                    || token.text().equals("await");
            case NUMBER, STRING -> true;
            case OPERATOR -> EXPRESSION_START_OPERATORS.contains(token.text());
            default -> false;
        };
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int distance) {
        int index = Math.min(current + distance, tokens.size() - 1);
        return tokens.get(index);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOp(String op) {
        return peek().isOperator(op);
    }

    private boolean checkAnyOp(String... ops) {
        for (String op : ops) {
            if (checkOp(op)) {
                return true;
            }
        }
        return false;
    }

    private boolean checkKeyword(String keyword) {
        return peek().isName(keyword);
    }

    private SyntaxNode advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.END_OF_FILE) {
            current++;
        }
        return SyntaxNode.leaf(token);
    }

    private SyntaxNode expect(TokenType type, String message) throws ParseException {
        if (!check(type)) {
            throw error(message);
        }
        return advance();
    }

    private SyntaxNode expectOp(String op) throws ParseException {
        if (!checkOp(op)) {
            throw error("expected '" + op + "'");
        }
        return advance();
    }

    private SyntaxNode expectKeyword(String keyword) throws ParseException {
        if (!checkKeyword(keyword)) {
            throw error("expected '" + keyword + "'");
        }
        return advance();
    }

    private SyntaxNode expectName() throws ParseException {
        if (!check(TokenType.NAME) || KEYWORDS.contains(peek().text())) {
            throw error("expected a name");
        }
        return advance();
    }

    private SyntaxNode nested(ParseStep step) throws ParseException {
        if (nesting >= MAX_NESTING) {
            throw error("too many nested parentheses");
        }
        nesting++;
        try {
            return step.parse();
        } finally {
            nesting--;
        }
    }

    private ParseException error(String message) {
        Token token = peek();
        String found = token.type() == TokenType.END_OF_FILE ? "end of file"
                : token.type() == TokenType.NEWLINE ? "end of line" : "'" + token.text() + "'";
        return new ParseException(message + " (found " + found + ")", token.position());
    }
}
