package org.jackanalyzer.compiler.frontend.parser;

import org.jackanalyzer.compiler.frontend.lexer.TokenSource;
import org.jackanalyzer.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Checks how the engine drives an arbitrary {@link TokenSource}, independent of the list-backed one.
 */
@Tag("unit")
public class CompilationEngineTokenSourceTest {

    @Test
    void exhaustedSourceIsNeverAdvanced() {
        TokenSource tokens = mock(TokenSource.class);
        when(tokens.hasMoreTokens()).thenReturn(false);
        when(tokens.mark()).thenReturn(-1);

        ParseException e = catchThrowableOfType(() -> new CompilationEngine(tokens).compileClass(), ParseException.class);

        assertThat(e.getKind()).isEqualTo(ParseErrorKind.NO_MORE_TOKENS);
        verify(tokens, never()).advance();
    }

    @Test
    void rejectedTokenIsHandedBack() {
        TokenSource tokens = mock(TokenSource.class);
        when(tokens.hasMoreTokens()).thenReturn(true);
        when(tokens.mark()).thenReturn(-1);
        when(tokens.tokenType()).thenReturn(TokenType.SYMBOL);

        ParseException e = catchThrowableOfType(() -> new CompilationEngine(tokens).compileClass(), ParseException.class);

        assertThat(e.getKind()).isEqualTo(ParseErrorKind.KEYWORD_NOT_FOUND);
        verify(tokens).advance();
        verify(tokens).reset(-1);
    }
}
