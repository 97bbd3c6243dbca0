package org.jackanalyzer.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parse tree of one class, recorded as the sequence of events the engine emits while it
 * walks the grammar: an opening tag and a closing tag around every rule, and one leaf per token.
 * <p>
 * The sequence only grows, except that a backtracking combinator may cut it back to a length
 * it saw earlier. Every rule closes what it opened, so a tree of a successful parse is well-nested.
 */
public class ParseTree {

    private final List<Event> events = new ArrayList<>();

    /**
     * One entry of the event sequence.
     *
     * @param kind What the event is.
     * @param name The rule name for open and close events, the token class tag for leaves.
     * @param text The token text for leaves, {@code null} otherwise.
     */
    public record Event(Kind kind, String name, String text) {

        /**
         * The kinds of tree events.
         */
        public enum Kind { OPEN, CLOSE, LEAF }
    }

    void open(String rule) {
        events.add(new Event(Event.Kind.OPEN, rule, null));
    }

    void close(String rule) {
        events.add(new Event(Event.Kind.CLOSE, rule, null));
    }

    void leaf(String tag, String text) {
        events.add(new Event(Event.Kind.LEAF, tag, text));
    }

    /**
     * @return The number of recorded events.
     */
    public int size() {
        return events.size();
    }

    void truncate(int size) {
        events.subList(size, events.size()).clear();
    }

    /**
     * @return An unmodifiable view of the recorded events, in emission order.
     */
    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Collects the leaf texts in order, which for a complete parse reproduces the token texts
     * of the class (string constants without their quotes).
     * @return The leaf texts.
     */
    public List<String> leafTexts() {
        List<String> texts = new ArrayList<>();
        for (Event event : events) {
            if (event.kind() == Event.Kind.LEAF) {
                texts.add(event.text());
            }
        }
        return texts;
    }

    /**
     * Renders the tree as markup without any whitespace between elements,
     * e.g. {@code <class><keyword>class</keyword>...</class>}.
     * @return The flat markup.
     */
    public String toMarkup() {
        StringBuilder sb = new StringBuilder();
        for (Event event : events) {
            switch (event.kind()) {
                case OPEN -> sb.append('<').append(event.name()).append('>');
                case CLOSE -> sb.append("</").append(event.name()).append('>');
                case LEAF -> sb.append('<').append(event.name()).append('>')
                        .append(escape(event.text()))
                        .append("</").append(event.name()).append('>');
            }
        }
        return sb.toString();
    }

    /**
     * Escapes the characters that may not appear literally in element content.
     * @param text The raw text.
     * @return The escaped text.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toMarkup();
    }
}
