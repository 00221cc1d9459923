package com.whosly.sqlfp.parser;

import com.whosly.sqlfp.tree.Limit;
import com.whosly.sqlfp.tree.QuoteStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SqlDialectTest {

    @ParameterizedTest(name = "fromName[{0}]")
    @ValueSource(strings = {"generic", "ansi", "mysql", "mariadb", "postgresql", "postgres", "sqlite", "mssql",
            "oracle"})
    void testRecognisedNames(String name) throws UnsupportedDialectException {
        assertThat(SqlDialect.fromName(name)).isNotNull();
    }

    @Test
    void testLookupIgnoresCase() throws UnsupportedDialectException {
        assertThat(SqlDialect.fromName("MySQL")).isEqualTo(SqlDialect.MYSQL);
        assertThat(SqlDialect.fromName(" Postgres ")).isEqualTo(SqlDialect.POSTGRESQL);
    }

    @Test
    void testUnknownDialect() {
        UnsupportedDialectException e = assertThrows(UnsupportedDialectException.class,
                () -> SqlDialect.fromName("not_a_dialect"));
        assertThat(e.getDialectName()).isEqualTo("not_a_dialect");
        assertThat(e.getMessage()).isEqualTo("Unsupported dialect: not_a_dialect");

        assertThrows(UnsupportedDialectException.class, () -> SqlDialect.fromName(null));
    }

    @Test
    void testCanonicalSpelling() {
        assertThat(SqlDialect.MYSQL.getIdentifierQuote()).isEqualTo(QuoteStyle.BACKTICK);
        assertThat(SqlDialect.MSSQL.getIdentifierQuote()).isEqualTo(QuoteStyle.BRACKET);
        assertThat(SqlDialect.POSTGRESQL.getIdentifierQuote()).isEqualTo(QuoteStyle.DOUBLE_QUOTE);

        assertThat(SqlDialect.ORACLE.getLimitStyle()).isEqualTo(Limit.Style.OFFSET_FETCH);
        assertThat(SqlDialect.MSSQL.getLimitStyle()).isEqualTo(Limit.Style.OFFSET_FETCH);
        assertThat(SqlDialect.SQLITE.getLimitStyle()).isEqualTo(Limit.Style.LIMIT_OFFSET);

        assertThat(SqlDialect.GENERIC.isDoubleQuotedStrings()).isTrue();
        assertThat(SqlDialect.POSTGRESQL.isDoubleQuotedStrings()).isFalse();

        assertThat(SqlDialect.MSSQL.supportsTop()).isTrue();
        assertThat(SqlDialect.MYSQL.supportsTop()).isFalse();
    }
}
