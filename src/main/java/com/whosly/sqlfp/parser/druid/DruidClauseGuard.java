package com.whosly.sqlfp.parser.druid;

import com.alibaba.druid.sql.ast.SQLCommentHint;
import com.alibaba.druid.sql.ast.SQLHint;
import com.alibaba.druid.sql.ast.SQLOver;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectGroupByClause;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSourceImpl;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlDeleteStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlInsertStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlSelectQueryBlock;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlUpdateStatement;
import com.alibaba.druid.sql.dialect.oracle.ast.stmt.OracleSelectQueryBlock;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGSelectQueryBlock;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGUpdateStatement;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.UnsupportedConstructException;

import java.util.Collection;
import java.util.List;

/**
 * Rejects clauses that Druid accepts but the tree does not model.
 *
 * Druid keeps such clauses in typed fields next to the ones the translator
 * reads. Each check looks at those fields for one node type, so a clause
 * is either translated or reported, never dropped.
 */
final class DruidClauseGuard {

    private final SqlDialect dialect;

    DruidClauseGuard(SqlDialect dialect) {
        this.dialect = dialect;
    }

    // statements

    void checkInsert(SQLInsertStatement insert) throws UnsupportedConstructException {
        reject(insert.getWith() != null, "WITH before INSERT");
        reject(isNotEmpty(insert.getPartitions()), "PARTITION");
        reject(insert.isOverwrite(), "INSERT OVERWRITE");
        reject(insert.getAlias() != null, "INSERT target alias");
        if (insert instanceof MySqlInsertStatement) {
            MySqlInsertStatement mysql = (MySqlInsertStatement) insert;
            reject(mysql.isLowPriority() || mysql.isDelayed() || mysql.isHighPriority(), "INSERT priority");
            reject(mysql.isRollbackOnFail() || mysql.isFulltextDictionary() || mysql.isIfNotExists(),
                    "INSERT option");
            checkHints(mysql.getHints());
        }
    }

    void checkUpdate(SQLUpdateStatement update) throws UnsupportedConstructException {
        reject(update.getWith() != null, "WITH before UPDATE");
        reject(isNotEmpty(update.getPartitions()), "PARTITION");
        if (update instanceof MySqlUpdateStatement) {
            MySqlUpdateStatement mysql = (MySqlUpdateStatement) update;
            reject(mysql.isIgnore(), "UPDATE IGNORE");
            reject(mysql.isLowPriority(), "UPDATE LOW_PRIORITY");
            reject(mysql.isCommitOnSuccess() || mysql.isRollBackOnFail() || mysql.isQueryOnPk()
                    || mysql.getTargetAffectRow() != null, "UPDATE option");
            reject(mysql.getForcePartition() != null || mysql.isForceAllPartitions(), "PARTITION");
            checkHints(mysql.getHints());
        }
        if (update instanceof PGUpdateStatement) {
            reject(((PGUpdateStatement) update).isOnly(), "UPDATE ONLY");
        }
    }

    void checkDelete(SQLDeleteStatement delete) throws UnsupportedConstructException {
        reject(delete.getWith() != null, "WITH before DELETE");
        reject(delete.isOnly(), "DELETE ONLY");
        reject(delete.getUsing() != null, "DELETE ... USING");
        reject(delete.getFrom() != null, "multi-table DELETE");
        if (delete instanceof MySqlDeleteStatement) {
            MySqlDeleteStatement mysql = (MySqlDeleteStatement) delete;
            reject(mysql.isLowPriority() || mysql.isQuick() || mysql.isIgnore(), "DELETE option");
            reject(mysql.getForcePartition() != null || mysql.isForceAllPartitions(), "PARTITION");
            checkHints(mysql.getHints());
        }
    }

    // queries

    void checkSelect(SQLSelect select) throws UnsupportedConstructException {
        reject(select.getRestriction() != null, "WITH CHECK OPTION");
        reject(select.isForBrowse(), "FOR BROWSE");
        reject(select.getXmlPath() != null || select.getForXmlOptionsSize() > 0, "FOR XML");
        checkHints(select.getHints());
    }

    void checkQueryBlock(SQLSelectQueryBlock block) throws UnsupportedConstructException {
        reject(block.getInto() != null, "SELECT INTO");
        reject(isNotEmpty(block.getWindows()), "WINDOW clause");
        reject(block.getQualify() != null, "QUALIFY");
        reject(block.getStartWith() != null || block.getConnectBy() != null, "hierarchical query");
        reject(block.getOrderBySiblings() != null, "ORDER SIBLINGS BY");
        reject(isNotEmpty(block.getDistributeBy()) || isNotEmpty(block.getSortBy())
                || isNotEmpty(block.getClusterBy()), "DISTRIBUTE BY");
        reject(block.isNoWait() || block.isSkipLocked() || block.getWaitTime() != null
                || block.getForUpdateOfSize() > 0, "locking option");
        reject(block.isForShare(), "FOR SHARE");
        checkHints(block.getHints());

        for (SQLSelectItem item : block.getSelectList()) {
            reject(item.isConnectByRoot(), "CONNECT_BY_ROOT");
            reject(isNotEmpty(item.getAliasList()), "alias list");
        }

        SQLSelectGroupByClause group = block.getGroupBy();
        if (group != null) {
            reject(group.isWithRollUp(), "WITH ROLLUP");
            reject(group.isWithCube(), "WITH CUBE");
            reject(group.isDistinct(), "GROUP BY DISTINCT");
        }

        if (block instanceof MySqlSelectQueryBlock) {
            MySqlSelectQueryBlock mysql = (MySqlSelectQueryBlock) block;
            reject(mysql.isLockInShareMode(), "LOCK IN SHARE MODE");
            reject(mysql.isCalcFoundRows(), "SQL_CALC_FOUND_ROWS");
            reject(mysql.isHignPriority() || mysql.isStraightJoin() || mysql.isSmallResult()
                    || mysql.isBigResult() || mysql.isBufferResult() || mysql.getCache() != null,
                    "SELECT modifier");
            reject(mysql.getProcedureName() != null, "PROCEDURE");
            reject(mysql.getForcePartition() != null, "PARTITION");
        }
        if (block instanceof PGSelectQueryBlock) {
            PGSelectQueryBlock pg = (PGSelectQueryBlock) block;
            reject(pg.getIntoOption() != null, "SELECT INTO");
            PGSelectQueryBlock.ForClause forClause = pg.getForClause();
            if (forClause != null) {
                reject(forClause.getOption() != PGSelectQueryBlock.ForClause.Option.UPDATE, "FOR SHARE");
                reject(isNotEmpty(forClause.getOf()) || forClause.isNoWait() || forClause.isSkipLocked(),
                        "locking option");
            }
            PGSelectQueryBlock.FetchClause fetch = pg.getFetch();
            reject(fetch != null && fetch.getCount() == null, "FETCH without row count");
        }
        if (block instanceof OracleSelectQueryBlock) {
            reject(((OracleSelectQueryBlock) block).getModelClause() != null, "MODEL clause");
        }
    }

    // relations

    void checkTableSource(SQLTableSource source) throws UnsupportedConstructException {
        if (source instanceof SQLTableSourceImpl) {
            SQLTableSourceImpl impl = (SQLTableSourceImpl) source;
            checkHints(impl.getHints());
            reject(impl.getFlashback() != null, "flashback query");
            reject(impl.getPivot() != null || impl.getUnpivot() != null, "PIVOT");
        }
        if (source instanceof SQLExprTableSource) {
            SQLExprTableSource table = (SQLExprTableSource) source;
            reject(table.getSampling() != null, "TABLESAMPLE");
            reject(table.getPartitionSize() > 0, "PARTITION");
            reject(isNotEmpty(table.getColumnsDirect()), "table column aliases");
        }
        if (source instanceof SQLSubqueryTableSource) {
            reject(isNotEmpty(((SQLSubqueryTableSource) source).getColumns()), "derived table column aliases");
        }
        if (source instanceof SQLJoinTableSource) {
            SQLJoinTableSource join = (SQLJoinTableSource) source;
            reject(join.getUdj() != null, "UDJ");
            reject(join.isAsof() || join.isGlobal(), "join modifier");
            reject(join.isNatural() && join.getJoinType() != SQLJoinTableSource.JoinType.NATURAL_JOIN,
                    "NATURAL " + join.getJoinType());
        }
    }

    // expressions

    void checkAggregate(SQLAggregateExpr aggregate) throws UnsupportedConstructException {
        String name = aggregate.getMethodName();
        reject(aggregate.getOverRef() != null, "named window in " + name);
        reject(aggregate.getKeep() != null, "KEEP in " + name);
        reject(aggregate.isWithinGroup() || aggregate.getWithinGroup() != null, "WITHIN GROUP in " + name);
        reject(aggregate.getIgnoreNulls() != null, "NULLS treatment in " + name);
        reject(aggregate.getOrderBy() != null, "ORDER BY in arguments of " + name);
        reject(aggregate.getAttribute("SEPARATOR") != null, "SEPARATOR in arguments of " + name);

        SQLOver over = aggregate.getOver();
        if (over != null) {
            reject(over.getOf() != null, "named window in " + name);
            reject(over.getWindowingType() != null, "window frame");
            reject(over.getDistributeBy() != null || over.getSortBy() != null || over.getClusterBy() != null
                    || over.isExcludeCurrentRow(), "window option");
        }
    }

    /**
     * Keyword argument forms such as {@code TRIM(BOTH 'x' FROM y)} or
     * {@code SUBSTRING(a FROM 1 FOR 2)}.
     */
    void checkMethod(SQLMethodInvokeExpr call) throws UnsupportedConstructException {
        boolean keywordArguments = call.getFrom() != null || call.getFor() != null || call.getUsing() != null
                || call.getTrimOption() != null;
        reject(keywordArguments, "keyword arguments of " + call.getMethodName());
    }

    // comment hints carry no meaning; anything else (index hints, optimizer options) does
    private void checkHints(List<? extends SQLHint> hints) throws UnsupportedConstructException {
        if (hints == null) {
            return;
        }
        for (SQLHint hint : hints) {
            reject(!(hint instanceof SQLCommentHint), "hint " + hint.getClass().getSimpleName());
        }
    }

    private static boolean isNotEmpty(Collection<?> items) {
        return items != null && !items.isEmpty();
    }

    private void reject(boolean present, String construct) throws UnsupportedConstructException {
        if (present) {
            throw new UnsupportedConstructException(construct, dialect);
        }
    }
}
