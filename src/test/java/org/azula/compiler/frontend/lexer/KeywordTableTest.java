package org.azula.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KeywordTable}.
 */
@Tag("unit")
class KeywordTableTest {

    @ParameterizedTest
    @CsvSource({
            "int,TYPE", "bool,TYPE", "string,TYPE", "float,TYPE", "error,TYPE", "void,TYPE",
            "func,FUNCTION", "return,RETURN", "as,AS", "struct,STRUCT",
            "true,TRUE", "false,FALSE", "or,OR", "and,AND",
            "if,IF", "elseif,ELSE_IF", "else,ELSE", "switch,SWITCH", "default,DEFAULT", "for,FOR"
    })
    void defaults_resolveEveryKeyword(String spelling, TokenKind expected) {
        assertThat(KeywordTable.defaults().resolve(spelling)).contains(expected);
        assertThat(KeywordTable.defaults().isKeyword(spelling)).isTrue();
    }

    @Test
    void defaults_size() {
        assertThat(KeywordTable.defaults().size()).isEqualTo(20);
    }

    @ParameterizedTest
    @ValueSource(strings = {"IF", "If", "main", "", "if ", "elif", "while", "=="})
    void resolve_unknownSpellingIsEmpty(String candidate) {
        assertThat(KeywordTable.defaults().resolve(candidate)).isEmpty();
        assertThat(KeywordTable.defaults().isKeyword(candidate)).isFalse();
    }

    @Test
    void resolve_nullIsEmpty() {
        assertThat(KeywordTable.defaults().resolve(null)).isEmpty();
    }

    @Test
    void defaults_isSharedInstance() {
        assertThat(KeywordTable.defaults()).isSameAs(KeywordTable.defaults());
    }

    @Test
    void asMap_isUnmodifiable() {
        Map<String, TokenKind> map = KeywordTable.defaults().asMap();

        assertThatThrownBy(() -> map.put("while", TokenKind.FOR)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void builder_extendsDefaults() {
        KeywordTable table = KeywordTable.builder()
                .addAll(KeywordTable.defaults())
                .add("while", TokenKind.FOR)
                .add("if", TokenKind.IF)
                .build();

        assertThat(table.size()).isEqualTo(21);
        assertThat(table.resolve("while")).contains(TokenKind.FOR);
        assertThat(KeywordTable.defaults().resolve("while")).isEmpty();
    }

    @Test
    void builder_rejectsConflictingMapping() {
        KeywordTable.Builder builder = KeywordTable.builder().add("if", TokenKind.IF);

        assertThatThrownBy(() -> builder.add("if", TokenKind.ELSE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already mapped to IF");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1st", "two words", "a-b", "<="})
    void builder_rejectsNonIdentifierKeys(String spelling) {
        assertThatThrownBy(() -> KeywordTable.builder().add(spelling, TokenKind.IDENTIFIER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("identifier-shaped");
    }

    @Test
    void builder_rejectsSentinelKinds() {
        assertThatThrownBy(() -> KeywordTable.builder().add("eof", TokenKind.END_OF_FILE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeywordTable.builder().add("bad", TokenKind.ILLEGAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builtTableIsNotAffectedByLaterBuilderChanges() {
        KeywordTable.Builder builder = KeywordTable.builder().add("let", TokenKind.IDENTIFIER);
        KeywordTable table = builder.build();

        builder.add("var", TokenKind.IDENTIFIER);

        assertThat(table.spellings()).containsExactly("let");
    }
}
