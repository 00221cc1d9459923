package com.whosly.sqlfp.parser.druid;

import com.whosly.sqlfp.parser.DruidSqlParser;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlFingerprintException;
import com.whosly.sqlfp.parser.UnsupportedConstructException;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.Statement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DruidClauseGuardTest {

    private final DruidSqlParser parser = new DruidSqlParser();

    @Test
    void testKeywordLikeNamesAreAccepted() throws SqlFingerprintException {
        assertThat(parser.parse("SELECT a FROM t WHERE range BETWEEN 1 AND 5", SqlDialect.POSTGRESQL))
                .isInstanceOf(SelectStatement.class);
        assertThat(parser.parse("SELECT a FROM t WHERE keep (1)", SqlDialect.POSTGRESQL))
                .isInstanceOf(SelectStatement.class);
        assertThat(parser.parse("SELECT returning FROM t", SqlDialect.MYSQL))
                .isInstanceOf(SelectStatement.class);
        assertThat(parser.parse("SELECT 'WINDOW w' AS w FROM t -- ROLLUP", SqlDialect.MYSQL))
                .isInstanceOf(SelectStatement.class);
    }

    @Test
    void testForUpdateIsAccepted() throws SqlFingerprintException {
        Statement statement = parser.parse("SELECT * FROM t WHERE id = 1 FOR UPDATE", SqlDialect.POSTGRESQL);

        Select select = (Select) ((SelectStatement) statement).getQuery().getBody();
        assertThat(select.isForUpdate()).isTrue();
    }

    @Test
    void testWindowClausesAreRejected() {
        assertRejected("SELECT sum(a) OVER w FROM t WINDOW w AS (PARTITION BY b)", SqlDialect.POSTGRESQL);
        assertRejected("SELECT sum(a) OVER (ORDER BY b ROWS BETWEEN 1 PRECEDING AND CURRENT ROW) FROM t",
                SqlDialect.POSTGRESQL);
    }

    @Test
    void testAggregateArgumentClausesAreRejected() {
        assertRejected("SELECT string_agg(a, ',' ORDER BY a) FROM t", SqlDialect.POSTGRESQL);
        assertRejected("SELECT percentile_cont(0.5) WITHIN GROUP (ORDER BY a) FROM t", SqlDialect.POSTGRESQL);
    }

    @Test
    void testMysqlModifiersAreRejected() {
        assertRejected("SELECT * FROM t FORCE INDEX (idx) WHERE a = 1", SqlDialect.MYSQL);
        assertRejected("SELECT SQL_CALC_FOUND_ROWS * FROM t LIMIT 10", SqlDialect.MYSQL);
        assertRejected("UPDATE IGNORE t SET a = 1", SqlDialect.MYSQL);
        assertRejected("UPDATE LOW_PRIORITY t SET a = 1", SqlDialect.MYSQL);
        assertRejected("SELECT a, COUNT(*) FROM t GROUP BY a WITH ROLLUP", SqlDialect.MYSQL);
    }

    @Test
    void testKeywordArgumentsAreRejected() {
        assertRejected("SELECT TRIM(BOTH 'x' FROM name) FROM t", SqlDialect.MYSQL);
    }

    @Test
    void testUnmodelledDeleteFormsAreRejected() {
        assertRejected("DELETE FROM t USING u WHERE t.id = u.id", SqlDialect.POSTGRESQL);
        assertRejected("DELETE t FROM t JOIN u ON t.id = u.id WHERE u.a = 1", SqlDialect.MYSQL);
    }

    @Test
    void testLockingVariantsAreRejected() {
        assertRejected("SELECT * FROM t FOR SHARE", SqlDialect.POSTGRESQL);
        assertRejected("SELECT * FROM t FOR UPDATE NOWAIT", SqlDialect.POSTGRESQL);
        assertRejected("SELECT * FROM t LOCK IN SHARE MODE", SqlDialect.MYSQL);
    }

    private void assertRejected(String sql, SqlDialect dialect) {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> parser.parse(sql, dialect));
        assertThat(e.getDialect()).isEqualTo(dialect);
    }
}
