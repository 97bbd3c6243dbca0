package org.jackanalyzer.compiler.output;

import org.jackanalyzer.compiler.frontend.parser.ParseTree;

/**
 * Renders a {@link ParseTree} in the layout of the Jack toolchain's reference comparison files:
 * one element per line, nested elements indented, leaf text padded by a single space.
 * <pre>
 * &lt;class&gt;
 *   &lt;keyword&gt; class &lt;/keyword&gt;
 *   &lt;identifier&gt; Main &lt;/identifier&gt;
 *   ...
 * &lt;/class&gt;
 * </pre>
 */
public class XmlTreeWriter {

    private final String indentUnit;

    /**
     * @param indent The number of spaces per nesting level.
     */
    public XmlTreeWriter(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must not be negative: " + indent);
        }
        this.indentUnit = " ".repeat(indent);
    }

    public String write(ParseTree tree) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        for (ParseTree.Event event : tree.events()) {
            switch (event.kind()) {
                case OPEN -> indent(sb, depth++).append('<').append(event.name()).append(">\n");
                case CLOSE -> indent(sb, --depth).append("</").append(event.name()).append(">\n");
                case LEAF -> indent(sb, depth).append(leaf(event.name(), event.text())).append('\n');
            }
        }
        if (depth != 0) {
            throw new IllegalStateException("Parse tree is not well-nested; " + depth + " element(s) left open.");
        }
        return sb.toString();
    }

    static String leaf(String tag, String text) {
        return "<" + tag + "> " + ParseTree.escape(text) + " </" + tag + ">";
    }

    private StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(indentUnit);
        }
        return sb;
    }
}
