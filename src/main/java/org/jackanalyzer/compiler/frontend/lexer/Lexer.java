package org.jackanalyzer.compiler.frontend.lexer;

import org.jackanalyzer.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * Jack source code into a sequence of classified tokens. Whitespace, line comments
 * and block comments (including documentation comments) are skipped.
 */
public class Lexer {

    /** The largest integer constant the Jack language allows. */
    public static final int MAX_INT_CONSTANT = 32767;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * Unlike an assembler lexer there is no end-of-file token; the end of the list is the end of input.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '"': string(); break;
            case '/':
                if (peek() == '/') {
                    // A line comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (peek() == '*') {
                    blockComment();
                } else {
                    addToken(TokenType.SYMBOL, Symbol.SLASH);
                }
                break;
            case ' ', '\r', '\t', '\f':
                break;
            case '\n':
                newLine();
                break;
            default:
                Symbol symbol = Symbol.fromChar(c);
                if (symbol != null) {
                    addToken(TokenType.SYMBOL, symbol);
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalFileName, line);
                }
                break;
        }
    }

    private void blockComment() {
        int openingLine = line;
        advance(); // consume '*'
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                newLine();
            } else if (c == '*' && peek() == '/') {
                advance();
                return;
            }
        }
        diagnostics.reportError("Unterminated comment.", logicalFileName, openingLine);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        Keyword keyword = Keyword.fromText(text);
        if (keyword != null) {
            addToken(TokenType.KEYWORD, keyword);
        } else {
            addToken(TokenType.IDENTIFIER, null);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        String numberString = source.substring(start, current);
        if (isAlpha(peek())) {
            diagnostics.reportError("Invalid number format: " + numberString + peek(), logicalFileName, line);
            return;
        }
        try {
            int value = Integer.parseInt(numberString);
            if (value > MAX_INT_CONSTANT) {
                diagnostics.reportError("Integer constant out of range (0.." + MAX_INT_CONSTANT + "): " + numberString, logicalFileName, line);
                return;
            }
            addToken(TokenType.INT_CONST, value);
        } catch (NumberFormatException e) {
            diagnostics.reportError("Integer constant out of range (0.." + MAX_INT_CONSTANT + "): " + numberString, logicalFileName, line);
        }
    }

    private void string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }

        if (peek() != '"') {
            diagnostics.reportError("Unterminated string.", logicalFileName, line);
            return;
        }

        // The closing "
        advance();

        // The text of the token is the string *with* quotes, the value is the content.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING_CONST, value);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, startColumn, logicalFileName));
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
