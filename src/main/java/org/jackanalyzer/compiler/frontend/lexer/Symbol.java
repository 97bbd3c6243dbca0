package org.jackanalyzer.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The single-character symbols of the Jack language together with their spelling.
 */
public enum Symbol {
    OPEN_BRACE('{'),
    CLOSE_BRACE('}'),
    OPEN_PAREN('('),
    CLOSE_PAREN(')'),
    OPEN_BRACKET('['),
    CLOSE_BRACKET(']'),
    DOT('.'),
    COMMA(','),
    SEMICOLON(';'),
    PLUS('+'),
    MINUS('-'),
    ASTERISK('*'),
    SLASH('/'),
    AMPERSAND('&'),
    PIPE('|'),
    LESS_THAN('<'),
    GREATER_THAN('>'),
    EQUALS('='),
    TILDE('~');

    private static final Map<Character, Symbol> BY_CHAR = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(Symbol::character, Function.identity())));

    private final char character;

    Symbol(char character) {
        this.character = character;
    }

    public char character() {
        return character;
    }

    public String text() {
        return String.valueOf(character);
    }

    /**
     * Looks up a symbol by its character.
     * @param c The candidate character.
     * @return The symbol, or {@code null} if the character is not a Jack symbol.
     */
    public static Symbol fromChar(char c) {
        return BY_CHAR.get(c);
    }
}
