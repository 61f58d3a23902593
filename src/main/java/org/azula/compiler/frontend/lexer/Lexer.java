package org.azula.compiler.frontend.lexer;

import org.azula.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Malformed input never aborts a scan. An unsupported character becomes a single
 * {@link TokenKind#ILLEGAL} token, and a string literal or block comment that runs
 * into the end of the file becomes one {@link TokenKind#ILLEGAL} token covering the
 * partial run. Each of these is also reported to the {@link DiagnosticsEngine}.
 * The token list always ends with exactly one {@link TokenKind#END_OF_FILE}.
 * <p>
 * A Lexer scans one source once and is not thread-safe.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);
    private static final int MAX_EXCERPT_LENGTH = 24;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String sourceFile;
    private final KeywordTable keywords;
    private final int tabWidth;
    private final List<Token> tokens = new ArrayList<>();
    private boolean scanned = false;
    private int illegalCount = 0;

    // Offsets into the source, in UTF-16 units.
    private int start = 0;
    private int current = 0;

    // Position of the cursor and of the first character of the token being scanned.
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param sourceFile The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceFile) {
        this(source, diagnostics, sourceFile, KeywordTable.defaults(), LexerOptions.defaults());
    }

    /**
     * Creates a new Lexer with an explicit keyword table and options.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param sourceFile The name of the file being scanned, for error reporting.
     * @param keywords The table used to tell keywords from identifiers.
     * @param options The lexer options.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceFile,
                 KeywordTable keywords, LexerOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.tabWidth = Objects.requireNonNull(options, "options").tabWidth();
    }

    /**
     * Performs the tokenization of the entire source code.
     * Calling it again returns the tokens of the first scan.
     * @return An unmodifiable list of the recognized tokens, ending with {@link TokenKind#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        if (scanned) {
            return Collections.unmodifiableList(tokens);
        }
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenKind.END_OF_FILE, "", sourceFile, line, column));
        scanned = true;

        LOG.debug("Scanned {} tokens from {} ({} illegal)", tokens.size(), sourceFile, illegalCount);
        return Collections.unmodifiableList(tokens);
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case '(' -> addToken(TokenKind.LPAREN);
            case ')' -> addToken(TokenKind.RPAREN);
            case '{' -> addToken(TokenKind.LBRACE);
            case '}' -> addToken(TokenKind.RBRACE);
            case '[' -> addToken(TokenKind.LBRACKET);
            case ']' -> addToken(TokenKind.RBRACKET);
            case ':' -> addToken(TokenKind.COLON);
            case ';' -> addToken(TokenKind.SEMICOLON);
            case ',' -> addToken(TokenKind.COMMA);
            case '+' -> addToken(TokenKind.PLUS);
            case '-' -> addToken(TokenKind.MINUS);
            case '*' -> addToken(TokenKind.ASTERISK);
            case '%' -> addToken(TokenKind.MODULO);
            // Two-character operators are tried before their one-character prefixes.
            case '=' -> addToken(match('=') ? TokenKind.EQ : TokenKind.ASSIGN);
            case '!' -> addToken(match('=') ? TokenKind.NOT_EQ : TokenKind.NOT);
            case '<' -> addToken(match('=') ? TokenKind.LT_EQ : TokenKind.LT);
            case '>' -> addToken(match('=') ? TokenKind.GT_EQ : TokenKind.GT);
            case '&' -> {
                if (match('&')) {
                    addToken(TokenKind.AND);
                } else {
                    illegal("Unexpected character");
                }
            }
            case '|' -> {
                if (match('|')) {
                    addToken(TokenKind.OR);
                } else {
                    illegal("Unexpected character");
                }
            }
            case '/' -> {
                if (match('/')) {
                    // A line comment goes until the end of the line.
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenKind.SLASH);
                }
            }
            case '"' -> string();
            // Ignore whitespace, advance() already moved the position.
            case ' ', '\r', '\t', '\n' -> { }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    illegal("Unexpected character");
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(keywords.resolve(text).orElse(TokenKind.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();
        // A fraction needs at least one digit after the dot.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        addToken(TokenKind.NUMBER);
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
            }
            advance();
        }

        if (isAtEnd()) {
            illegal("Unterminated string literal");
            return;
        }

        // The closing "
        advance();
        addToken(TokenKind.STRING);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        illegal("Unterminated block comment");
    }

    /**
     * Consumes one code point and moves the position past it.
     * This is the only place where line and column change.
     */
    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\t') {
            column += tabWidth;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private void illegal(String reason) {
        Token token = addToken(TokenKind.ILLEGAL);
        illegalCount++;
        diagnostics.reportError(reason + ": '" + excerpt(token.literal()) + "'", sourceFile, startLine, startColumn);
        LOG.trace("{} at {}:{}:{}", reason, sourceFile, startLine, startColumn);
    }

    /**
     * Shortens an illegal literal for a one-line diagnostic message.
     * Line breaks and tabs are escaped; runs longer than {@value #MAX_EXCERPT_LENGTH}
     * code points are cut and end in "...".
     */
    static String excerpt(String literal) {
        StringBuilder sb = new StringBuilder();
        int count = 0;
        for (int i = 0; i < literal.length(); ) {
            if (count == MAX_EXCERPT_LENGTH) {
                sb.append("...");
                break;
            }
            int c = literal.codePointAt(i);
            i += Character.charCount(c);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.appendCodePoint(c);
            }
            count++;
        }
        return sb.toString();
    }

    private Token addToken(TokenKind kind) {
        Token token = new Token(kind, source.substring(start, current), sourceFile, startLine, startColumn);
        tokens.add(token);
        return token;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
