package org.azula.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param kind The kind of the token (e.g., IF, IDENTIFIER, NUMBER).
 * @param literal The exact text of the token from the source code. Empty for {@link TokenKind#END_OF_FILE}.
 * @param sourceFile The logical file name from which this token originates.
 * @param line The 1-based line number where the token begins.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenKind kind,
        String literal,
        String sourceFile,
        int line,
        int column
) {

    public Token {
        if (literal == null) {
            literal = "";
        }
    }

    /**
     * @param other The kind to compare with.
     * @return {@code true} if this token is of the given kind.
     */
    public boolean is(TokenKind other) {
        return kind == other;
    }

    /**
     * @return {@code true} if this token is an {@link TokenKind#ILLEGAL} or {@link TokenKind#END_OF_FILE} marker.
     */
    public boolean isSentinel() {
        return kind != null && kind.isSentinel();
    }

    /**
     * Renders the token for diagnostics, e.g.
     * {@code Token IF (if) in main.az line 1, character 1}.
     * Tooling compares this output, so the shape must not change.
     *
     * @return The diagnostic rendering of this token.
     */
    public String describe() {
        String kindName = kind != null ? kind.diagnosticName() : "null";
        return "Token " + kindName + " (" + literal + ") in " + sourceFile
                + " line " + line + ", character " + column;
    }

    @Override
    public String toString() {
        return describe();
    }
}
