package org.jackanalyzer.compiler.output;

import org.jackanalyzer.compiler.diagnostics.DiagnosticsEngine;
import org.jackanalyzer.compiler.frontend.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class TokenListWriterTest {

    @Test
    void writesOneLeafPerToken() {
        String listing = TokenListWriter.write(new Lexer("let s = \"x>y\";", new DiagnosticsEngine()).scanTokens());

        assertThat(listing).isEqualTo(String.join("\n",
                "<tokens>",
                "<keyword> let </keyword>",
                "<identifier> s </identifier>",
                "<symbol> = </symbol>",
                "<stringConstant> x&gt;y </stringConstant>",
                "<symbol> ; </symbol>",
                "</tokens>",
                ""));
    }

    @Test
    void emptyTokenListStillHasRootElement() {
        assertThat(TokenListWriter.write(List.of())).isEqualTo("<tokens>\n</tokens>\n");
    }
}
