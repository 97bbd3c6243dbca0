package org.jackanalyzer.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the Jack language together with their spelling.
 */
public enum Keyword {
    CLASS("class"),
    CONSTRUCTOR("constructor"),
    FUNCTION("function"),
    METHOD("method"),
    FIELD("field"),
    STATIC("static"),
    VAR("var"),
    INT("int"),
    CHAR("char"),
    BOOLEAN("boolean"),
    VOID("void"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),
    THIS("this"),
    LET("let"),
    DO("do"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    RETURN("return");

    private static final Map<String, Keyword> BY_TEXT = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(Keyword::text, Function.identity())));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    /**
     * Gets the source spelling of this keyword.
     * @return The keyword text.
     */
    public String text() {
        return text;
    }

    /**
     * Looks up a keyword by its spelling. Keywords are case-sensitive.
     * @param text The candidate text.
     * @return The keyword, or {@code null} if the text is not reserved.
     */
    public static Keyword fromText(String text) {
        return BY_TEXT.get(text);
    }
}
