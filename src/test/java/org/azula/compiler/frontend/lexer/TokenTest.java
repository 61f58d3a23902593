package org.azula.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link Token} value type and its diagnostic rendering.
 */
@Tag("unit")
class TokenTest {

    @Test
    void describe_rendersFixedDiagnosticShape() {
        Token token = new Token(TokenKind.IF, "if", "t.az", 1, 1);

        assertThat(token.describe()).isEqualTo("Token IF (if) in t.az line 1, character 1");
        assertThat(token).hasToString("Token IF (if) in t.az line 1, character 1");
    }

    @Test
    void describe_usesDiagnosticNames() {
        assertThat(new Token(TokenKind.END_OF_FILE, "", "t.az", 3, 7).describe())
                .isEqualTo("Token EOF () in t.az line 3, character 7");
        assertThat(new Token(TokenKind.NOT_EQ, "!=", "main.az", 2, 10).describe())
                .isEqualTo("Token NOT_EQ (!=) in main.az line 2, character 10");
        assertThat(new Token(TokenKind.LPAREN, "(", "main.az", 1, 5).describe())
                .isEqualTo("Token LBRACKET (() in main.az line 1, character 5");
        assertThat(new Token(TokenKind.RBRACKET, "]", "main.az", 1, 5).describe())
                .isEqualTo("Token RSQUARE (]) in main.az line 1, character 5");
    }

    @Test
    void nullLiteral_becomesEmpty() {
        Token token = new Token(TokenKind.END_OF_FILE, null, "t.az", 1, 1);

        assertThat(token.literal()).isEmpty();
    }

    @Test
    void tokensWithSameFieldsAreEqual() {
        Token a = new Token(TokenKind.NUMBER, "10", "t.az", 1, 9);
        Token b = new Token(TokenKind.NUMBER, "10", "t.az", 1, 9);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new Token(TokenKind.NUMBER, "10", "t.az", 1, 10));
    }

    @Test
    void predicates() {
        Token illegal = new Token(TokenKind.ILLEGAL, "@", "t.az", 1, 1);
        Token ident = new Token(TokenKind.IDENTIFIER, "x", "t.az", 1, 1);

        assertThat(illegal.is(TokenKind.ILLEGAL)).isTrue();
        assertThat(illegal.isSentinel()).isTrue();
        assertThat(ident.is(TokenKind.ILLEGAL)).isFalse();
        assertThat(ident.isSentinel()).isFalse();
    }
}
