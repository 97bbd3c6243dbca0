package org.jackanalyzer.compiler.output;

import org.jackanalyzer.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Renders the token stream of a file as the flat {@code <tokens>} listing written to {@code XxxT.xml}.
 */
public final class TokenListWriter {

    private TokenListWriter() {}

    public static String write(List<Token> tokens) {
        StringBuilder sb = new StringBuilder("<tokens>\n");
        for (Token token : tokens) {
            sb.append(XmlTreeWriter.leaf(token.type().tagName(), token.leafText())).append('\n');
        }
        return sb.append("</tokens>\n").toString();
    }
}
