package org.azula.compiler.frontend.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * An immutable mapping from reserved spellings to token kinds.
 * <p>
 * The {@link Lexer} consults the table for every identifier-shaped run; a run that
 * is not in the table becomes an {@link TokenKind#IDENTIFIER}. Lookups are exact and
 * case-sensitive. Instances are safe to share between threads.
 */
public final class KeywordTable {

    private static final Pattern IDENTIFIER_SHAPE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final KeywordTable DEFAULTS = builder()
            .add("int", TokenKind.TYPE)
            .add("bool", TokenKind.TYPE)
            .add("string", TokenKind.TYPE)
            .add("float", TokenKind.TYPE)
            .add("error", TokenKind.TYPE)
            .add("void", TokenKind.TYPE)

            .add("func", TokenKind.FUNCTION)
            .add("return", TokenKind.RETURN)
            .add("as", TokenKind.AS)
            .add("struct", TokenKind.STRUCT)

            .add("true", TokenKind.TRUE)
            .add("false", TokenKind.FALSE)
            .add("or", TokenKind.OR)
            .add("and", TokenKind.AND)

            .add("if", TokenKind.IF)
            .add("elseif", TokenKind.ELSE_IF)
            .add("else", TokenKind.ELSE)
            .add("switch", TokenKind.SWITCH)
            .add("default", TokenKind.DEFAULT)
            .add("for", TokenKind.FOR)
            .build();

    private final Map<String, TokenKind> entries;

    private KeywordTable(Map<String, TokenKind> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Returns the keyword table of the Azula language. It is built once and shared.
     *
     * @return The default keyword table.
     */
    public static KeywordTable defaults() {
        return DEFAULTS;
    }

    /**
     * @return A builder for a new, empty table.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a candidate spelling.
     *
     * @param candidate The identifier-shaped run to classify.
     * @return The mapped kind, or empty if the candidate is not a keyword.
     */
    public Optional<TokenKind> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(candidate));
    }

    public boolean isKeyword(String candidate) {
        return candidate != null && entries.containsKey(candidate);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return The reserved spellings in insertion order.
     */
    public Set<String> spellings() {
        return entries.keySet();
    }

    /**
     * @return An unmodifiable view of all entries.
     */
    public Map<String, TokenKind> asMap() {
        return entries;
    }

    /**
     * Collects keyword entries. Adding a spelling never touches the scanning logic.
     */
    public static final class Builder {

        private final Map<String, TokenKind> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds a keyword.
         *
         * @param spelling The exact, case-sensitive spelling.
         * @param kind The kind the spelling maps to.
         * @return This builder.
         * @throws IllegalArgumentException if the spelling is not identifier-shaped, is already
         *         mapped to a different kind, or the kind is a sentinel.
         */
        public Builder add(String spelling, TokenKind kind) {
            Objects.requireNonNull(spelling, "spelling");
            Objects.requireNonNull(kind, "kind");
            if (!IDENTIFIER_SHAPE.matcher(spelling).matches()) {
                throw new IllegalArgumentException("Keyword is not identifier-shaped: '" + spelling + "'");
            }
            if (kind.isSentinel()) {
                throw new IllegalArgumentException("Keyword '" + spelling + "' cannot map to sentinel kind " + kind);
            }
            TokenKind existing = entries.putIfAbsent(spelling, kind);
            if (existing != null && existing != kind) {
                throw new IllegalArgumentException(String.format(
                        "Keyword '%s' is already mapped to %s, cannot remap to %s", spelling, existing, kind));
            }
            return this;
        }

        /**
         * Adds every entry of another table.
         *
         * @param other The table to copy from.
         * @return This builder.
         */
        public Builder addAll(KeywordTable other) {
            other.entries.forEach(this::add);
            return this;
        }

        public KeywordTable build() {
            return new KeywordTable(entries);
        }
    }
}
