package org.jackanalyzer.compiler.frontend.lexer;

import org.jackanalyzer.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ListTokenSourceTest {

    private static ListTokenSource sourceOf(String text) {
        return new ListTokenSource(new Lexer(text, new DiagnosticsEngine()).scanTokens());
    }

    @Test
    void noTokenIsCurrentBeforeTheFirstAdvance() {
        ListTokenSource tokens = sourceOf("var int x;");

        assertThat(tokens.current()).isNull();
        assertThat(tokens.hasMoreTokens()).isTrue();
        assertThatThrownBy(tokens::tokenType).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void accessorsReturnThePayloadOfTheCurrentToken() {
        ListTokenSource tokens = sourceOf("var count 12 \"s\" ;");

        tokens.advance();
        assertThat(tokens.tokenType()).isEqualTo(TokenType.KEYWORD);
        assertThat(tokens.keyword()).isEqualTo(Keyword.VAR);
        tokens.advance();
        assertThat(tokens.identifier()).isEqualTo("count");
        tokens.advance();
        assertThat(tokens.intVal()).isEqualTo(12);
        tokens.advance();
        assertThat(tokens.stringVal()).isEqualTo("s");
        tokens.advance();
        assertThat(tokens.symbol()).isEqualTo(Symbol.SEMICOLON);
        assertThat(tokens.hasMoreTokens()).isFalse();
    }

    @Test
    void accessorForAnotherKindIsRejected() {
        ListTokenSource tokens = sourceOf("count");
        tokens.advance();

        assertThatThrownBy(tokens::keyword)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IDENTIFIER");
    }

    @Test
    void advancePastTheLastTokenIsRejected() {
        ListTokenSource tokens = sourceOf(";");
        tokens.advance();

        assertThatThrownBy(tokens::advance).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resetRestoresAnEarlierMark() {
        ListTokenSource tokens = sourceOf("a b c");
        int start = tokens.mark();
        tokens.advance();
        int afterA = tokens.mark();
        tokens.advance();
        tokens.advance();

        tokens.reset(afterA);
        assertThat(tokens.identifier()).isEqualTo("a");
        tokens.reset(start);
        assertThat(tokens.current()).isNull();
        assertThatThrownBy(() -> tokens.reset(2)).isInstanceOf(IllegalArgumentException.class);
    }
}
