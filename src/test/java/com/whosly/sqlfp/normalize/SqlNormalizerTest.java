package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.parser.DruidSqlParser;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlFingerprintException;
import com.whosly.sqlfp.parser.SqlParseException;
import com.whosly.sqlfp.parser.SqlParser;
import com.whosly.sqlfp.parser.UnsupportedDialectException;
import com.whosly.sqlfp.tree.BinaryOperation;
import com.whosly.sqlfp.tree.BinaryOperator;
import com.whosly.sqlfp.tree.ColumnReference;
import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.LiteralKind;
import com.whosly.sqlfp.tree.Parenthesized;
import com.whosly.sqlfp.tree.QualifiedName;
import com.whosly.sqlfp.tree.Query;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectItem;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SqlNormalizerTest {

    private final SqlNormalizer normalizer = new SqlNormalizer(new DruidSqlParser());

    @Test
    void testStatementsDifferingOnlyInLiteralsShareHash() throws SqlFingerprintException {
        NormalizeResult first = normalizer.normalize("SELECT id FROM users WHERE id = 42");
        NormalizeResult second = normalizer.normalize("SELECT id FROM users WHERE id = 999");

        assertThat(first.getNormalized()).isEqualTo("SELECT id FROM users WHERE id = ?");
        assertThat(second.getNormalized()).isEqualTo(first.getNormalized());
        assertThat(second.getHash()).isEqualTo(first.getHash());
        assertThat(first.getParams()).containsExactly("42");
        assertThat(second.getParams()).containsExactly("999");
    }

    @Test
    void testPlaceholderEcho() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT 1", "generic", "<val>");

        assertThat(result.getNormalized()).isEqualTo("SELECT <val>");
        assertThat(result.getParams()).containsExactly("1");
    }

    @Test
    void testHashDependsOnlyOnNormalizedText() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT name FROM users WHERE id = 7 AND name = 'bob'");

        assertThat(result.getHash()).isEqualTo(FingerprintHasher.sha256Hex(result.getNormalized()));
        assertThat(result.getNormalized().chars().filter(c -> c == '?').count())
                .isEqualTo(result.getParams().size());
    }

    @Test
    void testDeterministic() throws SqlFingerprintException {
        String sql = "SELECT a, COUNT(*) FROM t WHERE b IN (1, 2) GROUP BY a HAVING COUNT(*) > 3 ORDER BY a DESC";

        NormalizeResult first = normalizer.normalize(sql, SqlDialect.POSTGRESQL);
        NormalizeResult second = normalizer.normalize(sql, SqlDialect.POSTGRESQL);

        assertThat(second).isEqualTo(first);
        assertThat(first.getParams()).containsExactly("1", "2", "3");
    }

    @Test
    void testMysqlLimitCommaForm() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT * FROM t LIMIT 20, 10", SqlDialect.MYSQL);

        assertThat(result.getNormalized()).isEqualTo("SELECT * FROM t LIMIT ? OFFSET ?");
        assertThat(result.getParams()).containsExactly("10", "20");
    }

    @Test
    void testWhitespaceAndCaseDoNotMatter() throws SqlFingerprintException {
        NormalizeResult compact = normalizer.normalize("select id from users where id=1");
        NormalizeResult spread = normalizer.normalize("SELECT   id\n  FROM users\n WHERE id = 2");

        assertThat(spread.getHash()).isEqualTo(compact.getHash());
    }

    @Test
    void testOnlyFirstStatementIsNormalized() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT 1; SELECT 2");

        assertThat(result.getNormalized()).isEqualTo("SELECT ?");
        assertThat(result.getParams()).containsExactly("1");
    }

    @Test
    void testDialectSensitivity() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT TOP 5 * FROM t", "mssql", "?");
        assertThat(result.getNormalized()).isEqualTo("SELECT TOP ? * FROM t");

        assertThrows(SqlFingerprintException.class, () -> normalizer.normalize("SELECT TOP 5 * FROM t", "ansi", "?"));
    }

    @Test
    void testUnknownDialectFailsBeforeParsing() {
        SqlParser parser = mock(SqlParser.class);
        SqlNormalizer mocked = new SqlNormalizer(parser);

        assertThrows(UnsupportedDialectException.class,
                () -> mocked.normalize("SELECT 1", "not_a_dialect", "?"));
        verifyNoInteractions(parser);
    }

    @Test
    void testPipelineOverParsedTree() throws SqlFingerprintException {
        SqlParser parser = mock(SqlParser.class);
        BinaryOperation condition = new BinaryOperation(BinaryOperator.EQUAL,
                new ColumnReference(QualifiedName.of("status")), new Literal(LiteralKind.STRING, "'open'"));
        Select select = new Select(false, null, List.of(new SelectItem(new ColumnReference(QualifiedName.of("id")), null)),
                new Table(QualifiedName.of("tickets"), null), new Parenthesized(condition), null, null, false);
        when(parser.parse("raw", SqlDialect.SQLITE)).thenReturn(new SelectStatement(Query.simple(select)));

        NormalizeResult result = new SqlNormalizer(parser).normalize("raw", SqlDialect.SQLITE);

        assertThat(result.getOriginal()).isEqualTo("raw");
        assertThat(result.getNormalized()).isEqualTo("SELECT id FROM tickets WHERE status = ?");
        assertThat(result.getParams()).containsExactly("'open'");
        verify(parser).parse("raw", SqlDialect.SQLITE);
    }

    @Test
    void testParamsFollowTextOrderThroughNestedConstructs() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize(
                "SELECT * FROM t WHERE a IN (1, (SELECT 2 WHERE b = 3)) AND c = CASE WHEN d = 4 THEN 5 ELSE 6 END",
                SqlDialect.POSTGRESQL);

        assertThat(result.getParams()).containsExactly("1", "2", "3", "4", "5", "6");
        assertThat(result.getNormalized().chars().filter(c -> c == '?').count()).isEqualTo(6);
    }

    @Test
    void testLiteralsKeepSourceSpelling() throws SqlFingerprintException {
        assertThat(normalizer.normalize("SELECT * FROM t WHERE x = 00010").getParams()).containsExactly("00010");
        assertThat(normalizer.normalize("SELECT * FROM t WHERE x = 1.50 AND y = 1.5", SqlDialect.POSTGRESQL)
                .getParams()).containsExactly("1.50", "1.5");

        NormalizeResult mysql = normalizer.normalize("SELECT * FROM users WHERE name = \"bob\"", SqlDialect.MYSQL);
        assertThat(mysql.getNormalized()).isEqualTo("SELECT * FROM users WHERE name = ?");
        assertThat(mysql.getParams()).containsExactly("\"bob\"");

        NormalizeResult escaped = normalizer.normalize("SELECT * FROM t WHERE a = 'it''s'", SqlDialect.POSTGRESQL);
        assertThat(escaped.getParams()).containsExactly("'it''s'");
    }

    @Test
    void testDistinctOnIsKept() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize("SELECT DISTINCT ON (a) a, b FROM t ORDER BY a",
                SqlDialect.POSTGRESQL);

        assertThat(result.getNormalized()).isEqualTo("SELECT DISTINCT ON (a) a, b FROM t ORDER BY a");
        assertThat(result.getHash())
                .isNotEqualTo(normalizer.normalize("SELECT DISTINCT a, b FROM t ORDER BY a", SqlDialect.POSTGRESQL)
                        .getHash());
    }

    @Test
    void testReturningClauses() throws SqlFingerprintException {
        assertThat(normalizer.normalize("INSERT INTO users (name) VALUES ('x') RETURNING id", SqlDialect.POSTGRESQL)
                .getNormalized()).isEqualTo("INSERT INTO users (name) VALUES (?) RETURNING id");
        assertThat(normalizer.normalize("UPDATE users SET name = 'x' WHERE id = 1 RETURNING id, name",
                SqlDialect.POSTGRESQL).getNormalized())
                .isEqualTo("UPDATE users SET name = ? WHERE id = ? RETURNING id, name");

        NormalizeResult delete = normalizer.normalize("DELETE FROM users WHERE id = 7 RETURNING id",
                SqlDialect.POSTGRESQL);
        assertThat(delete.getNormalized()).isEqualTo("DELETE FROM users WHERE id = ? RETURNING id");
        assertThat(delete.getParams()).containsExactly("7");
        assertThat(normalizer.normalize("DELETE FROM users WHERE id = 7 RETURNING *", SqlDialect.POSTGRESQL)
                .getNormalized()).isEqualTo("DELETE FROM users WHERE id = ? RETURNING *");
    }

    @Test
    void testOnConflict() throws SqlFingerprintException {
        NormalizeResult nothing = normalizer.normalize(
                "INSERT INTO users (id, email) VALUES (1, 'a@b.c') ON CONFLICT DO NOTHING", SqlDialect.POSTGRESQL);
        assertThat(nothing.getNormalized()).isEqualTo("INSERT INTO users (id, email) VALUES (?, ?) ON CONFLICT DO NOTHING");
        assertThat(nothing.getParams()).containsExactly("1", "'a@b.c'");

        NormalizeResult update = normalizer.normalize("INSERT INTO users (id, email) VALUES (1, 'a@b.c') "
                + "ON CONFLICT (id) DO UPDATE SET email = EXCLUDED.email", SqlDialect.POSTGRESQL);
        assertThat(update.getNormalized()).isEqualTo("INSERT INTO users (id, email) VALUES (?, ?) "
                + "ON CONFLICT (id) DO UPDATE SET email = EXCLUDED.email");
    }

    @Test
    void testAggregateFilter() throws SqlFingerprintException {
        NormalizeResult result = normalizer.normalize(
                "SELECT COUNT(*) FILTER (WHERE is_active = TRUE) FROM users", SqlDialect.POSTGRESQL);

        assertThat(result.getNormalized()).isEqualTo("SELECT COUNT(*) FILTER (WHERE is_active = ?) FROM users");
        assertThat(result.getParams()).containsExactly("TRUE");
    }

    @Test
    void testOrmStatementsWithQuotedNames() throws SqlFingerprintException {
        NormalizeResult update = normalizer.normalize("UPDATE \"profile_profile\" SET \"bio\" = 'hello' "
                + "WHERE \"profile_profile\".\"id\" = 5 RETURNING \"profile_profile\".\"id\"", SqlDialect.POSTGRESQL);
        assertThat(update.getNormalized()).isEqualTo("UPDATE \"profile_profile\" SET \"bio\" = ? "
                + "WHERE \"profile_profile\".\"id\" = ? RETURNING \"profile_profile\".\"id\"");
        assertThat(update.getParams()).containsExactly("'hello'", "5");

        NormalizeResult insert = normalizer.normalize("INSERT INTO \"auth_user\" (\"username\", \"is_staff\") "
                + "VALUES ('ann', false) RETURNING \"auth_user\".\"id\"", SqlDialect.POSTGRESQL);
        assertThat(insert.getNormalized()).isEqualTo("INSERT INTO \"auth_user\" (\"username\", \"is_staff\") "
                + "VALUES (?, ?) RETURNING \"auth_user\".\"id\"");
    }

    @Test
    void testDefaultValuesUnderSqlite() throws SqlFingerprintException {
        assertThat(normalizer.normalize("INSERT INTO t DEFAULT VALUES", SqlDialect.SQLITE).getNormalized())
                .isEqualTo("INSERT INTO t DEFAULT VALUES");
    }

    @Test
    void testTemporalLiteralsPerDialect() throws SqlFingerprintException {
        for (SqlDialect dialect : new SqlDialect[]{SqlDialect.GENERIC, SqlDialect.ANSI, SqlDialect.SQLITE,
                SqlDialect.POSTGRESQL, SqlDialect.MYSQL, SqlDialect.MARIADB, SqlDialect.ORACLE}) {
            NormalizeResult result = normalizer.normalize("SELECT * FROM t WHERE d > DATE '2024-01-01'", dialect);

            assertThat(result.getNormalized()).as(dialect.name()).isEqualTo("SELECT * FROM t WHERE d > ?");
            assertThat(result.getParams()).as(dialect.name()).hasSize(1);
            assertThat(result.getParams().get(0)).as(dialect.name())
                    .startsWithIgnoringCase("DATE").contains("2024-01-01");
        }

        NormalizeResult timestamp = normalizer.normalize(
                "SELECT * FROM t WHERE d > TIMESTAMP '2024-01-01 10:00:00' AND e = 'x'", SqlDialect.POSTGRESQL);
        assertThat(timestamp.getParams()).hasSize(2);
        assertThat(timestamp.getParams().get(0)).contains("2024-01-01 10:00:00");
        assertThat(timestamp.getParams().get(1)).isEqualTo("'x'");

        NormalizeResult mysqlInterval = normalizer.normalize("SELECT * FROM t WHERE d > c - INTERVAL 1 DAY",
                SqlDialect.MYSQL);
        assertThat(mysqlInterval.getNormalized()).isEqualTo("SELECT * FROM t WHERE d > c - ?");
        assertThat(mysqlInterval.getParams()).hasSize(1);

        NormalizeResult oracleInterval = normalizer.normalize("SELECT INTERVAL '1' DAY FROM dual", SqlDialect.ORACLE);
        assertThat(oracleInterval.getNormalized()).isEqualTo("SELECT ? FROM dual");
        assertThat(oracleInterval.getParams()).hasSize(1);
    }

    @Test
    void testDateLiteralIsNotTransactSql() {
        assertThrows(SqlParseException.class,
                () -> normalizer.normalize("SELECT * FROM t WHERE d > DATE '2024-01-01'", SqlDialect.MSSQL));
    }
}
