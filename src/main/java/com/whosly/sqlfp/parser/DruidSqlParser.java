package com.whosly.sqlfp.parser;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.parser.SQLExprParser;
import com.alibaba.druid.sql.parser.SQLParserUtils;
import com.alibaba.druid.sql.parser.Token;
import com.whosly.sqlfp.parser.druid.DruidTreeTranslator;
import com.whosly.sqlfp.parser.druid.SourceText;
import com.whosly.sqlfp.tree.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of SqlParser using Alibaba Druid.
 *
 * Generic, ANSI and SQLite input is read with Druid's PostgreSQL grammar,
 * the broadest one that keeps double quotes for identifiers.
 */
public class DruidSqlParser implements SqlParser {

    private static final Logger log = LoggerFactory.getLogger(DruidSqlParser.class);

    @Override
    public Statement parse(String sql, SqlDialect dialect) throws SqlParseException, UnsupportedConstructException {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(dialect, "dialect");
        DbType dbType = toDbType(dialect);
        SourceText source = SourceText.scan(sql, dbType);

        int returning = deleteReturningStart(source, dbType);
        String statementSql = returning < 0 ? sql : sql.substring(0, returning);

        List<SQLStatement> statements;
        try {
            statements = SQLUtils.parseStatements(statementSql, dbType);
        } catch (RuntimeException e) {
            // ParserException, and the unchecked exceptions Druid throws on some malformed input
            log.debug("Failed to parse SQL as {}: {}", dialect.getDisplayName(), sql, e);
            throw new SqlParseException("Parse error: " + describe(e), e);
        }

        if (statements.isEmpty()) {
            throw new SqlParseException("No SQL statement found");
        }
        if (statements.size() > 1) {
            log.debug("Input holds {} statements, only the first is normalized", statements.size());
        }

        List<SQLExpr> deleteReturning = List.of();
        if (returning >= 0) {
            String items = sql.substring(returning + "RETURNING".length(), source.getStatementEnd());
            deleteReturning = parseReturningItems(items, dbType);
        }
        return new DruidTreeTranslator(dialect, dbType, source).translate(statements.get(0), deleteReturning);
    }

    /**
     * Druid's PostgreSQL grammar accepts only {@code RETURNING *} after a
     * DELETE. The items are cut off the statement and parsed as an
     * expression list instead.
     *
     * @return the offset of the RETURNING keyword, or -1
     */
    private static int deleteReturningStart(SourceText source, DbType dbType) {
        if (dbType != DbType.postgresql || !"DELETE".equals(source.firstWord())) {
            return -1;
        }
        return source.indexOfTopLevelWord("RETURNING");
    }

    private static List<SQLExpr> parseReturningItems(String items, DbType dbType) throws SqlParseException {
        List<SQLExpr> exprs = new ArrayList<>();
        Token next;
        try {
            SQLExprParser exprParser = SQLParserUtils.createExprParser(items, dbType);
            exprParser.exprList(exprs);
            next = exprParser.getLexer().token();
        } catch (RuntimeException e) {
            throw new SqlParseException("Parse error: " + describe(e), e);
        }
        if (exprs.isEmpty() || next != Token.EOF) {
            throw new SqlParseException("Parse error: malformed RETURNING list: " + items.trim());
        }
        return exprs;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    public boolean validate(String sql, SqlDialect dialect) {
        try {
            parse(sql, dialect);
            return true;
        } catch (SqlFingerprintException e) {
            log.debug("SQL rejected: {}", e.getMessage());
            return false;
        }
    }

    static DbType toDbType(SqlDialect dialect) {
        switch (dialect) {
            case MYSQL:
                return DbType.mysql;
            case MARIADB:
                return DbType.mariadb;
            case POSTGRESQL:
                return DbType.postgresql;
            case MSSQL:
                return DbType.sqlserver;
            case ORACLE:
                return DbType.oracle;
            case GENERIC:
            case ANSI:
            case SQLITE:
            default:
                return DbType.postgresql;
        }
    }
}
