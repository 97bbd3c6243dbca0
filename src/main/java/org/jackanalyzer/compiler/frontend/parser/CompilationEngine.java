package org.jackanalyzer.compiler.frontend.parser;

import org.jackanalyzer.compiler.frontend.lexer.Keyword;
import org.jackanalyzer.compiler.frontend.lexer.Symbol;
import org.jackanalyzer.compiler.frontend.lexer.Token;
import org.jackanalyzer.compiler.frontend.lexer.TokenSource;
import org.jackanalyzer.compiler.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The recursive-descent parser for the Jack language. It drives a {@link TokenSource} through
 * the grammar and records a {@link ParseTree} as a side effect: one tagged element per rule
 * and one leaf per consumed token.
 * <p>
 * Rules are built from three layers:
 * <ul>
 *     <li>terminal eaters, which check the current token and append a leaf,</li>
 *     <li>{@link #takeNextToken(Rule)}, the only place the cursor moves forward,</li>
 *     <li>the combinators {@link #zeroOrMore(Rule)}, {@link #zeroOrOne(Rule)} and {@link #or(Rule...)},
 *     which snapshot the parse state before an attempt and restore it when the attempt does not apply.</li>
 * </ul>
 * A failed attempt is recoverable when its outcome is {@link ParseOutcome.Status#NOT_APPLICABLE}, or when
 * it failed on the very token it started on. Once an attempt has consumed a token, a malformed token
 * after it aborts the parse.
 * <p>
 * An engine is single-use: exactly one {@code compile*} entry point may be called.
 */
public class CompilationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationEngine.class);

    private final ParseState state;
    private boolean used = false;

    /**
     * Creates an engine bound to the given token source. No token may have been consumed yet.
     * @param tokens The token source.
     */
    public CompilationEngine(TokenSource tokens) {
        this.state = new ParseState(tokens);
    }

    // region Entry points

    /**
     * Parses a complete class declaration.
     * @throws ParseException if the tokens do not form a class.
     */
    public void compileClass() throws ParseException {
        run("class", this::parseClass);
    }

    public void compileClassVarDec() throws ParseException {
        run("classVarDec", this::parseClassVarDec);
    }

    public void compileSubroutineDec() throws ParseException {
        run("subroutineDec", this::parseSubroutineDec);
    }

    public void compileParameterList() throws ParseException {
        run("parameterList", this::parseParameterList);
    }

    public void compileSubroutineBody() throws ParseException {
        run("subroutineBody", this::parseSubroutineBody);
    }

    public void compileVarDec() throws ParseException {
        run("varDec", this::parseVarDec);
    }

    public void compileStatements() throws ParseException {
        run("statements", this::parseStatements);
    }

    public void compileLet() throws ParseException {
        run("letStatement", this::parseLetStatement);
    }

    public void compileIf() throws ParseException {
        run("ifStatement", this::parseIfStatement);
    }

    public void compileWhile() throws ParseException {
        run("whileStatement", this::parseWhileStatement);
    }

    public void compileDo() throws ParseException {
        run("doStatement", this::parseDoStatement);
    }

    public void compileReturn() throws ParseException {
        run("returnStatement", this::parseReturnStatement);
    }

    public void compileExpression() throws ParseException {
        run("expression", this::parseExpression);
    }

    public void compileTerm() throws ParseException {
        run("term", this::parseTerm);
    }

    public void compileExpressionList() throws ParseException {
        run("expressionList", this::parseExpressionList);
    }

    /**
     * Returns the tree as flat markup. Only complete after an entry point returned normally.
     * @return The markup.
     */
    public String xml() {
        return state.tree().toMarkup();
    }

    public ParseTree tree() {
        return state.tree();
    }

    private void run(String rule, Rule entry) throws ParseException {
        if (used) {
            throw new IllegalStateException("CompilationEngine is single-use; cannot parse '" + rule + "' after a previous parse.");
        }
        used = true;
        LOG.debug("Parsing {}", rule);
        ParseOutcome outcome = entry.parse();
        if (!outcome.isMatched()) {
            ParseException exception = state.toException(outcome);
            LOG.debug("Parsing {} failed: {}", rule, exception.getMessage());
            throw exception;
        }
    }

    // endregion

    // region Grammar productions

    private ParseOutcome parseClass() {
        return production("class",
                keyword(Keyword.CLASS),
                identifier(),
                symbol(Symbol.OPEN_BRACE),
                () -> zeroOrMore(this::parseClassVarDec),
                () -> zeroOrMore(this::parseSubroutineDec),
                symbol(Symbol.CLOSE_BRACE));
    }

    private ParseOutcome parseClassVarDec() {
        return production("classVarDec",
                () -> or(keyword(Keyword.STATIC), keyword(Keyword.FIELD)),
                type(),
                identifier(),
                () -> zeroOrMore(() -> sequence(symbol(Symbol.COMMA), identifier())),
                symbol(Symbol.SEMICOLON));
    }

    private ParseOutcome parseSubroutineDec() {
        return production("subroutineDec",
                () -> or(keyword(Keyword.CONSTRUCTOR), keyword(Keyword.FUNCTION), keyword(Keyword.METHOD)),
                () -> or(keyword(Keyword.VOID), type()),
                identifier(),
                symbol(Symbol.OPEN_PAREN),
                this::parseParameterList,
                symbol(Symbol.CLOSE_PAREN),
                this::parseSubroutineBody);
    }

    private ParseOutcome parseParameterList() {
        return production("parameterList",
                () -> zeroOrOne(() -> sequence(
                        type(),
                        identifier(),
                        () -> zeroOrMore(() -> sequence(symbol(Symbol.COMMA), type(), identifier())))));
    }

    private ParseOutcome parseSubroutineBody() {
        return production("subroutineBody",
                symbol(Symbol.OPEN_BRACE),
                () -> zeroOrMore(this::parseVarDec),
                this::parseStatements,
                symbol(Symbol.CLOSE_BRACE));
    }

    private ParseOutcome parseVarDec() {
        return production("varDec",
                keyword(Keyword.VAR),
                type(),
                identifier(),
                () -> zeroOrMore(() -> sequence(symbol(Symbol.COMMA), identifier())),
                symbol(Symbol.SEMICOLON));
    }

    private ParseOutcome parseStatements() {
        return production("statements",
                () -> zeroOrMore(this::parseStatement));
    }

    // statement: dispatched by its leading keyword, no element of its own
    private ParseOutcome parseStatement() {
        return or(this::parseLetStatement,
                this::parseIfStatement,
                this::parseWhileStatement,
                this::parseDoStatement,
                this::parseReturnStatement);
    }

    private ParseOutcome parseLetStatement() {
        return production("letStatement",
                keyword(Keyword.LET),
                identifier(),
                () -> zeroOrOne(this::arraySubscript),
                symbol(Symbol.EQUALS),
                this::parseExpression,
                symbol(Symbol.SEMICOLON));
    }

    private ParseOutcome parseIfStatement() {
        return production("ifStatement",
                keyword(Keyword.IF),
                symbol(Symbol.OPEN_PAREN),
                this::parseExpression,
                symbol(Symbol.CLOSE_PAREN),
                this::block,
                () -> zeroOrOne(() -> sequence(keyword(Keyword.ELSE), this::block)));
    }

    private ParseOutcome parseWhileStatement() {
        return production("whileStatement",
                keyword(Keyword.WHILE),
                symbol(Symbol.OPEN_PAREN),
                this::parseExpression,
                symbol(Symbol.CLOSE_PAREN),
                this::block);
    }

    private ParseOutcome parseDoStatement() {
        return production("doStatement",
                keyword(Keyword.DO),
                identifier(),
                this::callSuffix,
                symbol(Symbol.SEMICOLON));
    }

    private ParseOutcome parseReturnStatement() {
        return production("returnStatement",
                keyword(Keyword.RETURN),
                () -> zeroOrOne(this::parseExpression),
                symbol(Symbol.SEMICOLON));
    }

    // Jack has no operator precedence: operators apply left to right as written.
    private ParseOutcome parseExpression() {
        return production("expression",
                this::parseTerm,
                () -> zeroOrMore(() -> sequence(this::op, this::parseTerm)));
    }

    private ParseOutcome parseTerm() {
        return production("term",
                () -> or(next(this::eatIntegerConstant),
                        next(this::eatStringConstant),
                        this::keywordConstant,
                        () -> sequence(symbol(Symbol.OPEN_PAREN), this::parseExpression, symbol(Symbol.CLOSE_PAREN)),
                        () -> sequence(this::unaryOp, this::parseTerm),
                        // varName, varName[expression] and both forms of subroutineCall share the leading identifier
                        () -> sequence(identifier(), () -> zeroOrOne(() -> or(this::arraySubscript, this::callSuffix)))));
    }

    private ParseOutcome parseExpressionList() {
        return production("expressionList",
                () -> zeroOrOne(() -> sequence(
                        this::parseExpression,
                        () -> zeroOrMore(() -> sequence(symbol(Symbol.COMMA), this::parseExpression)))));
    }

    private ParseOutcome block() {
        return sequence(symbol(Symbol.OPEN_BRACE), this::parseStatements, symbol(Symbol.CLOSE_BRACE));
    }

    private ParseOutcome arraySubscript() {
        return sequence(symbol(Symbol.OPEN_BRACKET), this::parseExpression, symbol(Symbol.CLOSE_BRACKET));
    }

    // The part of a subroutine call after its first identifier: ('.' subroutineName)? '(' expressionList ')'
    private ParseOutcome callSuffix() {
        return sequence(
                () -> zeroOrOne(() -> sequence(symbol(Symbol.DOT), identifier())),
                symbol(Symbol.OPEN_PAREN),
                this::parseExpressionList,
                symbol(Symbol.CLOSE_PAREN));
    }

    private ParseOutcome keywordConstant() {
        return or(keyword(Keyword.TRUE), keyword(Keyword.FALSE), keyword(Keyword.NULL), keyword(Keyword.THIS));
    }

    private ParseOutcome op() {
        return or(symbol(Symbol.PLUS), symbol(Symbol.MINUS), symbol(Symbol.ASTERISK), symbol(Symbol.SLASH),
                symbol(Symbol.AMPERSAND), symbol(Symbol.PIPE), symbol(Symbol.LESS_THAN), symbol(Symbol.GREATER_THAN),
                symbol(Symbol.EQUALS));
    }

    private ParseOutcome unaryOp() {
        return or(symbol(Symbol.MINUS), symbol(Symbol.TILDE));
    }

    private ParseOutcome production(String name, Rule... steps) {
        LOG.trace("Entering {}", name);
        state.tree().open(name);
        ParseOutcome outcome = sequence(steps);
        if (outcome.isMatched()) {
            state.tree().close(name);
        }
        return outcome;
    }

    private ParseOutcome sequence(Rule... steps) {
        for (Rule step : steps) {
            ParseOutcome outcome = step.parse();
            if (!outcome.isMatched()) {
                return outcome;
            }
        }
        return ParseOutcome.matched();
    }

    private Rule keyword(Keyword expected) {
        return next(() -> eatKeyword(expected));
    }

    private Rule symbol(Symbol expected) {
        return next(() -> eatSymbol(expected));
    }

    private Rule identifier() {
        return next(this::eatIdentifier);
    }

    private Rule type() {
        return next(this::eatType);
    }

    private Rule next(Rule validate) {
        return () -> takeNextToken(validate);
    }

    // endregion

    // region Combinators

    /**
     * Advances to the next token and validates it. If validation fails the cursor is moved back,
     * so the token is still in flight for whatever the caller tries next.
     * @param validate A terminal eater for the new current token.
     * @return The validation outcome, or a {@link ParseErrorKind#NO_MORE_TOKENS} failure.
     */
    ParseOutcome takeNextToken(Rule validate) {
        ParseState.Mark before = state.mark();
        if (!state.tokens().hasMoreTokens()) {
            return state.failAtEnd("more input");
        }
        state.tokens().advance();
        ParseOutcome outcome = validate.parse();
        if (!outcome.isMatched()) {
            state.restore(before);
        }
        return outcome;
    }

    /**
     * Runs the rule until it no longer applies. A failed attempt is rolled back completely.
     * @param rule The repeated rule.
     * @return Matched, or the first failure that is not recoverable.
     */
    ParseOutcome zeroOrMore(Rule rule) {
        while (true) {
            ParseState.Mark start = state.mark();
            ParseOutcome outcome = rule.parse();
            if (!outcome.isMatched()) {
                if (!isRecoverable(outcome, start)) {
                    return outcome;
                }
                LOG.trace("Repetition stopped at token {}: {}", outcome.position(), outcome.kind());
                state.restore(start);
                return ParseOutcome.matched();
            }
            if (state.mark().tokenPosition() == start.tokenPosition()) {
                // an iteration that consumes nothing would repeat forever
                return ParseOutcome.matched();
            }
        }
    }

    /**
     * Runs the rule once if it applies.
     * @param rule The optional rule.
     * @return Matched, or the failure if it is not recoverable.
     */
    ParseOutcome zeroOrOne(Rule rule) {
        ParseState.Mark start = state.mark();
        ParseOutcome outcome = rule.parse();
        if (outcome.isMatched()) {
            return outcome;
        }
        if (!isRecoverable(outcome, start)) {
            return outcome;
        }
        state.restore(start);
        return ParseOutcome.matched();
    }

    /**
     * Tries the alternatives in order from the same starting state; the first that matches wins.
     * @param alternatives The alternatives, in order of precedence.
     * @return Matched, the first failure that is not recoverable, or the failure of the last alternative.
     */
    ParseOutcome or(Rule... alternatives) {
        if (alternatives.length == 0) {
            throw new IllegalArgumentException("or() needs at least one alternative");
        }
        ParseState.Mark start = state.mark();
        ParseOutcome last = null;
        for (Rule alternative : alternatives) {
            ParseOutcome outcome = alternative.parse();
            if (outcome.isMatched()) {
                return outcome;
            }
            if (!isRecoverable(outcome, start)) {
                return outcome;
            }
            state.restore(start);
            last = outcome;
        }
        return last;
    }

    private boolean isRecoverable(ParseOutcome outcome, ParseState.Mark start) {
        if (outcome.status() == ParseOutcome.Status.NOT_APPLICABLE) {
            return true;
        }
        // a wrong keyword or symbol before the attempt got past its first token just means it does not apply
        return outcome.kind() != ParseErrorKind.NO_MORE_TOKENS && outcome.position() <= start.nextTokenIndex();
    }

    // endregion

    // region Terminal eaters

    /**
     * Checks that the current token is the given keyword and appends its leaf.
     * @param expected The keyword.
     * @return The outcome.
     */
    ParseOutcome eatKeyword(Keyword expected) {
        TokenSource tokens = state.tokens();
        String wanted = "'" + expected.text() + "'";
        if (tokens.tokenType() != TokenType.KEYWORD) {
            return state.failOnCurrent(ParseErrorKind.KEYWORD_NOT_FOUND, wanted);
        }
        if (tokens.keyword() != expected) {
            return state.failOnCurrent(ParseErrorKind.WRONG_KEYWORD, wanted);
        }
        return leaf(tokens.current());
    }

    /**
     * Checks that the current token is the given symbol and appends its leaf.
     * @param expected The symbol.
     * @return The outcome.
     */
    ParseOutcome eatSymbol(Symbol expected) {
        TokenSource tokens = state.tokens();
        String wanted = "'" + expected.text() + "'";
        if (tokens.tokenType() != TokenType.SYMBOL) {
            return state.failOnCurrent(ParseErrorKind.SYMBOL_NOT_FOUND, wanted);
        }
        if (tokens.symbol() != expected) {
            return state.failOnCurrent(ParseErrorKind.WRONG_SYMBOL, wanted);
        }
        return leaf(tokens.current());
    }

    ParseOutcome eatIdentifier() {
        if (state.tokens().tokenType() != TokenType.IDENTIFIER) {
            return state.failOnCurrent(ParseErrorKind.IDENTIFIER_NOT_FOUND, "identifier");
        }
        return leaf(state.tokens().current());
    }

    ParseOutcome eatIntegerConstant() {
        if (state.tokens().tokenType() != TokenType.INT_CONST) {
            return state.failOnCurrent(ParseErrorKind.INTEGER_CONSTANT_NOT_FOUND, "integer constant");
        }
        return leaf(state.tokens().current());
    }

    ParseOutcome eatStringConstant() {
        if (state.tokens().tokenType() != TokenType.STRING_CONST) {
            return state.failOnCurrent(ParseErrorKind.STRING_CONSTANT_NOT_FOUND, "string constant");
        }
        return leaf(state.tokens().current());
    }

    /**
     * Checks that the current token names a type: {@code int}, {@code char}, {@code boolean} or a class name.
     * @return The outcome of the last alternative tried.
     */
    ParseOutcome eatType() {
        return or(() -> eatKeyword(Keyword.INT),
                () -> eatKeyword(Keyword.CHAR),
                () -> eatKeyword(Keyword.BOOLEAN),
                this::eatIdentifier);
    }

    private ParseOutcome leaf(Token token) {
        state.tree().leaf(token.type().tagName(), token.leafText());
        return ParseOutcome.matched();
    }

    // endregion
}
