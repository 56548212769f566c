package com.gatekeeper.auth.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.InvalidDataAccessApiUsageException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PlaceholderTranslator")
class PlaceholderTranslatorTest {

    @Test
    @DisplayName("replaces named placeholders with positional markers")
    void translate() {
        var translated = PlaceholderTranslator.translate("UPDATE t SET a = %(a)s WHERE id = %(w0)s");

        assertThat(translated.sql()).isEqualTo("UPDATE t SET a = ? WHERE id = ?");
        assertThat(translated.names()).containsExactly("a", "w0");
    }

    @Test
    @DisplayName("leaves quoted literals alone")
    void literals() {
        var translated = PlaceholderTranslator.translate("SELECT '%(x)s', b FROM t WHERE c LIKE 'a%' AND d = %(d)s");

        assertThat(translated.sql()).isEqualTo("SELECT '%(x)s', b FROM t WHERE c LIKE 'a%' AND d = ?");
        assertThat(translated.names()).containsExactly("d");
    }

    @Test
    @DisplayName("reads %% as a literal percent sign")
    void escapedPercent() {
        var translated = PlaceholderTranslator.translate(
                "SELECT * FROM t WHERE a LIKE 'x%%' AND b LIKE %(b)s || '%%' AND c = 100 %% 7 AND d = '%%(e)s'");

        assertThat(translated.sql())
                .isEqualTo("SELECT * FROM t WHERE a LIKE 'x%' AND b LIKE ? || '%' AND c = 100 % 7 AND d = '%(e)s'");
        assertThat(translated.names()).containsExactly("b");
    }

    @Test
    @DisplayName("leaves quoted identifiers alone")
    void quotedIdentifiers() {
        var translated = PlaceholderTranslator.translate("SELECT \"it's %(x)s\" FROM t WHERE a = %(a)s");

        assertThat(translated.sql()).isEqualTo("SELECT \"it's %(x)s\" FROM t WHERE a = ?");
        assertThat(translated.names()).containsExactly("a");
    }

    @Test
    @DisplayName("leaves line comments alone")
    void lineComments() {
        var translated = PlaceholderTranslator.translate("-- filter by %(old)s, don't\nSELECT * FROM t WHERE a = %(a)s");

        assertThat(translated.sql()).isEqualTo("-- filter by %(old)s, don't\nSELECT * FROM t WHERE a = ?");
        assertThat(translated.names()).containsExactly("a");
    }

    @Test
    @DisplayName("binds values in placeholder order, repeating names as needed")
    void bind() {
        var translated = PlaceholderTranslator.translate("SELECT %(a)s, %(b)s, %(a)s");

        assertThat(translated.bind(Map.of("a", 1, "b", 2))).containsExactly(1, 2, 1);
    }

    @Test
    @DisplayName("binds group i of a multi-row statement to payload i")
    void bindGroups() {
        var translated = PlaceholderTranslator.translate("INSERT INTO t (a, b) VALUES (%(a)s, %(b)s), (%(a)s, %(b)s)");

        Object[] args = translated.bindGroups(List.of(Map.of("a", 1, "b", 2), Map.of("a", 3, "b", 4)));

        assertThat(args).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("fails on a placeholder without a value")
    void missing() {
        var translated = PlaceholderTranslator.translate("SELECT * FROM t WHERE a = %(a)s");

        assertThatThrownBy(() -> translated.bind(Map.of()))
                .isInstanceOf(InvalidDataAccessApiUsageException.class)
                .hasMessageContaining("%(a)s");
    }
}
