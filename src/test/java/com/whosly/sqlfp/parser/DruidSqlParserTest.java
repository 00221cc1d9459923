package com.whosly.sqlfp.parser;

import com.alibaba.druid.DbType;
import com.whosly.sqlfp.tree.DeleteStatement;
import com.whosly.sqlfp.tree.InsertStatement;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.Statement;
import com.whosly.sqlfp.tree.UpdateStatement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

class DruidSqlParserTest {

    private final DruidSqlParser parser = new DruidSqlParser();

    @Test
    void testValidSqlParsing() {
        String sql = "SELECT * FROM users WHERE id = 1";
        try {
            Statement statement = parser.parse(sql, SqlDialect.GENERIC);
            assertThat(statement).isInstanceOf(SelectStatement.class);
        } catch (SqlFingerprintException e) {
            fail("Should not throw exception for valid SQL");
        }
    }

    @Test
    void testInvalidSqlParsing() {
        String sql = "INVALID SQL STATEMENT";

        SqlParseException e = assertThrows(SqlParseException.class, () -> {
            parser.parse(sql, SqlDialect.GENERIC);
        });
        assertThat(e.getMessage()).startsWith("Parse error: ");
        assertThat(e.getCause()).isNotNull();
    }

    @Test
    void testEmptyInput() {
        SqlParseException e = assertThrows(SqlParseException.class, () -> parser.parse("", SqlDialect.GENERIC));
        assertThat(e.getMessage()).isEqualTo("No SQL statement found");
    }

    @Test
    void testSqlValidation() {
        String validSql = "SELECT * FROM users";
        String invalidSql = "INVALID SQL";

        assertThat(parser.validate(validSql, SqlDialect.GENERIC)).isTrue();
        assertThat(parser.validate(invalidSql, SqlDialect.GENERIC)).isFalse();
    }

    @Test
    void testDmlStatements() throws SqlFingerprintException {
        assertThat(parser.parse("INSERT INTO users (id, name) VALUES (1, 'a')", SqlDialect.GENERIC))
                .isInstanceOf(InsertStatement.class);
        assertThat(parser.parse("UPDATE users SET name = 'x' WHERE id = 5", SqlDialect.GENERIC))
                .isInstanceOf(UpdateStatement.class);
        assertThat(parser.parse("DELETE FROM users WHERE id = 5", SqlDialect.GENERIC))
                .isInstanceOf(DeleteStatement.class);
    }

    @Test
    void testTopDependsOnDialect() throws SqlFingerprintException {
        Statement statement = parser.parse("SELECT TOP 5 * FROM t", SqlDialect.MSSQL);
        Select select = (Select) ((SelectStatement) statement).getQuery().getBody();
        assertThat(select.getTop()).isNotNull();

        assertThrows(SqlFingerprintException.class, () -> parser.parse("SELECT TOP 5 * FROM t", SqlDialect.ANSI));
    }

    @Test
    void testUnsupportedStatement() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> parser.parse("CREATE TABLE t (id INT)", SqlDialect.GENERIC));
        assertThat(e.getDialect()).isEqualTo(SqlDialect.GENERIC);
        assertThat(e.getMessage()).startsWith("Unsupported construct for Generic dialect: ");
    }

    @Test
    void testUnmodelledClauseIsRejected() {
        assertThrows(UnsupportedConstructException.class,
                () -> parser.parse("SELECT sum(a) OVER w FROM t WINDOW w AS (PARTITION BY b)", SqlDialect.POSTGRESQL));
        assertThrows(UnsupportedConstructException.class,
                () -> parser.parse("SELECT a, COUNT(*) FROM t GROUP BY a WITH ROLLUP", SqlDialect.MYSQL));
    }

    @Test
    void testUncheckedDruidFailuresBecomeParseErrors() {
        assertParseError("SET \";JOIN\" /*LIMIT FROM /*UNION 1e", SqlDialect.MSSQL);
        assertParseError("UPDATE LIMITSET UNIONCASEUPDATE ,AS UNIONJOININ", SqlDialect.MYSQL);
        assertParseError("VALUES AS.'", SqlDialect.POSTGRESQL);
        assertParseError("xa", SqlDialect.MYSQL);
    }

    private void assertParseError(String sql, SqlDialect dialect) {
        SqlParseException e = assertThrows(SqlParseException.class, () -> parser.parse(sql, dialect));
        assertThat(e.getMessage()).startsWith("Parse error: ");
        assertThat(e.getCause()).isInstanceOf(RuntimeException.class);
    }

    @Test
    void testMalformedDeleteReturningList() {
        SqlParseException e = assertThrows(SqlParseException.class,
                () -> parser.parse("DELETE FROM t WHERE id = 1 RETURNING id id2 id3", SqlDialect.POSTGRESQL));
        assertThat(e.getMessage()).startsWith("Parse error: ");
        assertThrows(SqlParseException.class,
                () -> parser.parse("DELETE FROM t WHERE id = 1 RETURNING", SqlDialect.POSTGRESQL));
    }

    @Test
    void testDeleteReturningList() throws SqlFingerprintException {
        DeleteStatement delete = (DeleteStatement) parser.parse(
                "DELETE FROM t WHERE id = 1 RETURNING id, name;", SqlDialect.POSTGRESQL);

        assertThat(delete.getReturning()).hasSize(2);
        assertThat(delete.getWhere()).isNotNull();
    }

    @Test
    void testDbTypeMapping() {
        assertThat(DruidSqlParser.toDbType(SqlDialect.GENERIC)).isEqualTo(DbType.postgresql);
        assertThat(DruidSqlParser.toDbType(SqlDialect.ANSI)).isEqualTo(DbType.postgresql);
        assertThat(DruidSqlParser.toDbType(SqlDialect.SQLITE)).isEqualTo(DbType.postgresql);
        assertThat(DruidSqlParser.toDbType(SqlDialect.MSSQL)).isEqualTo(DbType.sqlserver);
        assertThat(DruidSqlParser.toDbType(SqlDialect.MARIADB)).isEqualTo(DbType.mariadb);
    }
}
