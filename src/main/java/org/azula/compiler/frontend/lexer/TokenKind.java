package org.azula.compiler.frontend.lexer;

/**
 * Defines the closed set of token kinds that the {@link Lexer} can produce.
 * <p>
 * Consumers that dispatch on a kind should use an exhaustive {@code switch} expression
 * without a {@code default} branch, so that adding a constant fails their build.
 */
public enum TokenKind {
    // Sentinels.
    /** Any input the lexer does not recognize. */
    ILLEGAL(Category.SENTINEL),
    /** Marks the end of a source file. */
    END_OF_FILE(Category.SENTINEL, "EOF"),

    // Literals & names.
    /** A type name, such as {@code int} or {@code string}. */
    TYPE(Category.LITERAL),
    /** A variable or function name. */
    IDENTIFIER(Category.LITERAL),
    /** A string literal, quotes included. */
    STRING(Category.LITERAL),
    /** A numeric literal, such as {@code 42} or {@code 3.14}. */
    NUMBER(Category.LITERAL),

    // Declarative keywords.
    /** {@code func} */
    FUNCTION(Category.DECLARATIVE_KEYWORD),
    /** {@code return} */
    RETURN(Category.DECLARATIVE_KEYWORD),
    /** {@code as}, used to cast one type to another. */
    AS(Category.DECLARATIVE_KEYWORD),
    /** {@code struct} */
    STRUCT(Category.DECLARATIVE_KEYWORD),
    /** {@code true} */
    TRUE(Category.DECLARATIVE_KEYWORD),
    /** {@code false} */
    FALSE(Category.DECLARATIVE_KEYWORD),

    // Punctuation.
    /** {@code =} */
    ASSIGN(Category.PUNCTUATION),
    /** {@code :}, introduces a return type. */
    COLON(Category.PUNCTUATION),
    /** {@code ;} */
    SEMICOLON(Category.PUNCTUATION),
    /** {@code ,} */
    COMMA(Category.PUNCTUATION),

    // Operators.
    PLUS(Category.OPERATOR),
    MINUS(Category.OPERATOR),
    ASTERISK(Category.OPERATOR),
    SLASH(Category.OPERATOR),
    MODULO(Category.OPERATOR),
    /** {@code ==} */
    EQ(Category.OPERATOR),
    /** {@code !=} */
    NOT_EQ(Category.OPERATOR),
    LT(Category.OPERATOR),
    GT(Category.OPERATOR),
    /** {@code <=} */
    LT_EQ(Category.OPERATOR),
    /** {@code >=} */
    GT_EQ(Category.OPERATOR),
    /** {@code or} or {@code ||} */
    OR(Category.OPERATOR),
    /** {@code and} or {@code &&} */
    AND(Category.OPERATOR),
    /** {@code !} */
    NOT(Category.OPERATOR),

    // Control flow keywords.
    IF(Category.CONTROL_FLOW_KEYWORD),
    ELSE_IF(Category.CONTROL_FLOW_KEYWORD, "ELSEIF"),
    ELSE(Category.CONTROL_FLOW_KEYWORD),
    SWITCH(Category.CONTROL_FLOW_KEYWORD),
    /** The fallback branch of a {@code switch}. */
    DEFAULT(Category.CONTROL_FLOW_KEYWORD),
    FOR(Category.CONTROL_FLOW_KEYWORD),

    // Delimiters.
    /** {@code (} */
    LPAREN(Category.DELIMITER, "LBRACKET"),
    /** {@code )} */
    RPAREN(Category.DELIMITER, "RBRACKET"),
    /** <code>{</code> */
    LBRACE(Category.DELIMITER),
    /** <code>}</code> */
    RBRACE(Category.DELIMITER),
    /** {@code [} */
    LBRACKET(Category.DELIMITER, "LSQUARE"),
    /** {@code ]} */
    RBRACKET(Category.DELIMITER, "RSQUARE");

    /**
     * The role a token kind plays in the language.
     */
    public enum Category {
        /** Tokens that mark an error or the end of the stream. */
        SENTINEL,
        /** Names and literal values. */
        LITERAL,
        /** Keywords that declare or produce values. */
        DECLARATIVE_KEYWORD,
        /** Separators and the assignment sign. */
        PUNCTUATION,
        /** Arithmetic, comparison and logical operators. */
        OPERATOR,
        /** Keywords that steer control flow. */
        CONTROL_FLOW_KEYWORD,
        /** Paired brackets. */
        DELIMITER
    }

    private final Category category;
    private final String diagnosticName;

    TokenKind(Category category) {
        this.category = category;
        this.diagnosticName = name();
    }

    TokenKind(Category category, String diagnosticName) {
        this.category = category;
        this.diagnosticName = diagnosticName;
    }

    /**
     * @return The category this kind belongs to.
     */
    public Category category() {
        return category;
    }

    /**
     * Returns the name used when rendering a token for diagnostics.
     * Existing Azula tooling compares these names, so they differ from the
     * constant name for a few kinds (e.g. {@code EOF} for {@link #END_OF_FILE}).
     *
     * @return The diagnostic name of this kind.
     */
    public String diagnosticName() {
        return diagnosticName;
    }

    /**
     * @return {@code true} for {@link #ILLEGAL} and {@link #END_OF_FILE}.
     */
    public boolean isSentinel() {
        return category == Category.SENTINEL;
    }
}
