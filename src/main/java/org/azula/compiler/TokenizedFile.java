package org.azula.compiler;

import org.azula.compiler.diagnostics.Diagnostic;
import org.azula.compiler.frontend.lexer.Token;
import org.azula.compiler.frontend.lexer.TokenKind;

import java.util.List;

/**
 * The result of scanning one {@link SourceFile}.
 *
 * @param source The scanned file.
 * @param tokens The tokens, ending with {@link TokenKind#END_OF_FILE}.
 * @param diagnostics The diagnostics reported while scanning this file.
 */
public record TokenizedFile(SourceFile source, List<Token> tokens, List<Diagnostic> diagnostics) {

    public TokenizedFile {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return {@code true} if at least one {@link TokenKind#ILLEGAL} token was produced.
     */
    public boolean hasIllegalTokens() {
        return tokens.stream().anyMatch(t -> t.is(TokenKind.ILLEGAL));
    }
}
