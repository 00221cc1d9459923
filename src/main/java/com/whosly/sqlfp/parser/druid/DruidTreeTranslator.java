package com.whosly.sqlfp.parser.druid;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLLimit;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.SQLOrderBy;
import com.alibaba.druid.sql.ast.SQLOrderingSpecification;
import com.alibaba.druid.sql.ast.SQLOver;
import com.alibaba.druid.sql.ast.SQLSetQuantifier;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLAggregateOption;
import com.alibaba.druid.sql.ast.expr.SQLAllColumnExpr;
import com.alibaba.druid.sql.ast.expr.SQLAllExpr;
import com.alibaba.druid.sql.ast.expr.SQLAnyExpr;
import com.alibaba.druid.sql.ast.expr.SQLArrayExpr;
import com.alibaba.druid.sql.ast.expr.SQLBetweenExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExprGroup;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.expr.SQLCaseExpr;
import com.alibaba.druid.sql.ast.expr.SQLCastExpr;
import com.alibaba.druid.sql.ast.expr.SQLCharExpr;
import com.alibaba.druid.sql.ast.expr.SQLDateExpr;
import com.alibaba.druid.sql.ast.expr.SQLDateTimeExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLExtractExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLInListExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLIntegerExpr;
import com.alibaba.druid.sql.ast.expr.SQLIntervalExpr;
import com.alibaba.druid.sql.ast.expr.SQLListExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLNCharExpr;
import com.alibaba.druid.sql.ast.expr.SQLNotExpr;
import com.alibaba.druid.sql.ast.expr.SQLNumberExpr;
import com.alibaba.druid.sql.ast.expr.SQLNumericLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLSomeExpr;
import com.alibaba.druid.sql.ast.expr.SQLTimeExpr;
import com.alibaba.druid.sql.ast.expr.SQLTimestampExpr;
import com.alibaba.druid.sql.ast.expr.SQLUnaryExpr;
import com.alibaba.druid.sql.ast.expr.SQLVariantRefExpr;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLReplaceStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectGroupByClause;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectOrderByItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUnionOperator;
import com.alibaba.druid.sql.ast.statement.SQLUnionQuery;
import com.alibaba.druid.sql.ast.statement.SQLUnionQueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlDeleteStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlInsertStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlUpdateStatement;
import com.alibaba.druid.sql.dialect.oracle.ast.expr.OracleIntervalExpr;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGDeleteStatement;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGInsertStatement;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGSelectQueryBlock;
import com.alibaba.druid.sql.dialect.sqlserver.ast.SQLServerSelectQueryBlock;
import com.alibaba.druid.sql.dialect.sqlserver.ast.SQLServerTop;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.UnsupportedConstructException;
import com.whosly.sqlfp.tree.Alias;
import com.whosly.sqlfp.tree.AllColumns;
import com.whosly.sqlfp.tree.ArrayConstructor;
import com.whosly.sqlfp.tree.Assignment;
import com.whosly.sqlfp.tree.BetweenPredicate;
import com.whosly.sqlfp.tree.BinaryOperation;
import com.whosly.sqlfp.tree.BinaryOperator;
import com.whosly.sqlfp.tree.BindParameter;
import com.whosly.sqlfp.tree.CaseExpression;
import com.whosly.sqlfp.tree.CastExpression;
import com.whosly.sqlfp.tree.ColumnReference;
import com.whosly.sqlfp.tree.CommonTableExpression;
import com.whosly.sqlfp.tree.DataType;
import com.whosly.sqlfp.tree.DeleteStatement;
import com.whosly.sqlfp.tree.DerivedTable;
import com.whosly.sqlfp.tree.ExistsPredicate;
import com.whosly.sqlfp.tree.Expression;
import com.whosly.sqlfp.tree.ExpressionList;
import com.whosly.sqlfp.tree.ExtractExpression;
import com.whosly.sqlfp.tree.FunctionCall;
import com.whosly.sqlfp.tree.GroupBy;
import com.whosly.sqlfp.tree.Identifier;
import com.whosly.sqlfp.tree.InListPredicate;
import com.whosly.sqlfp.tree.InSubqueryPredicate;
import com.whosly.sqlfp.tree.InsertStatement;
import com.whosly.sqlfp.tree.IsPredicate;
import com.whosly.sqlfp.tree.Join;
import com.whosly.sqlfp.tree.KeywordExpression;
import com.whosly.sqlfp.tree.Limit;
import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.LiteralKind;
import com.whosly.sqlfp.tree.OnConflict;
import com.whosly.sqlfp.tree.OrderBy;
import com.whosly.sqlfp.tree.QualifiedName;
import com.whosly.sqlfp.tree.QuantifiedSubquery;
import com.whosly.sqlfp.tree.Query;
import com.whosly.sqlfp.tree.QueryBody;
import com.whosly.sqlfp.tree.Relation;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectItem;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.SetOperation;
import com.whosly.sqlfp.tree.SortItem;
import com.whosly.sqlfp.tree.Statement;
import com.whosly.sqlfp.tree.SubqueryExpression;
import com.whosly.sqlfp.tree.Table;
import com.whosly.sqlfp.tree.Top;
import com.whosly.sqlfp.tree.UnaryOperation;
import com.whosly.sqlfp.tree.UnaryOperator;
import com.whosly.sqlfp.tree.UpdateStatement;
import com.whosly.sqlfp.tree.WhenClause;
import com.whosly.sqlfp.tree.WindowSpecification;
import com.whosly.sqlfp.tree.With;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts a Druid AST into the engine tree.
 *
 * Every Druid node type is either translated or rejected with
 * {@link UnsupportedConstructException}. Nothing is dropped silently. One
 * instance translates one statement.
 */
public final class DruidTreeTranslator {

    /**
     * Druid literal node types by simple class name. Looking them up by name
     * keeps dialect specific literal classes out of the import list.
     */
    private static final Map<String, LiteralKind> LITERAL_TYPES = new HashMap<>();

    static {
        for (String type : new String[]{"SQLIntegerExpr", "SQLNumberExpr", "SQLBigIntExpr", "SQLSmallIntExpr",
                "SQLTinyIntExpr", "SQLFloatExpr", "SQLDoubleExpr", "SQLDecimalExpr", "SQLRealExpr"}) {
            LITERAL_TYPES.put(type, LiteralKind.NUMERIC);
        }
        for (String type : new String[]{"SQLCharExpr", "SQLNCharExpr", "MySqlCharExpr", "SQLHexExpr", "SQLBinaryExpr"}) {
            LITERAL_TYPES.put(type, LiteralKind.STRING);
        }
        LITERAL_TYPES.put("SQLBooleanExpr", LiteralKind.BOOLEAN);
        LITERAL_TYPES.put("SQLNullExpr", LiteralKind.NULL);
        for (String type : new String[]{"SQLDateExpr", "SQLTimeExpr", "SQLTimestampExpr", "SQLDateTimeExpr",
                "SQLIntervalExpr", "OracleIntervalExpr"}) {
            LITERAL_TYPES.put(type, LiteralKind.TEMPORAL);
        }
    }

    private static final Set<String> KEYWORD_TYPES = Set.of(
            "SQLCurrentTimeExpr", "SQLCurrentUserExpr", "OracleSysdateExpr", "SQLDefaultExpr");

    private final SqlDialect dialect;
    private final DbType dbType;
    private final SourceText source;
    private final DruidClauseGuard guard;

    public DruidTreeTranslator(SqlDialect dialect, DbType dbType, SourceText source) {
        this.dialect = dialect;
        this.dbType = dbType;
        this.source = source;
        this.guard = new DruidClauseGuard(dialect);
    }

    public Statement translate(SQLStatement statement) throws UnsupportedConstructException {
        return translate(statement, List.of());
    }

    /**
     * @param deleteReturning RETURNING items parsed apart from a DELETE whose
     *                        grammar only accepts {@code RETURNING *}
     */
    public Statement translate(SQLStatement statement, List<SQLExpr> deleteReturning)
            throws UnsupportedConstructException {
        if (statement instanceof SQLSelectStatement) {
            return new SelectStatement(query(((SQLSelectStatement) statement).getSelect()));
        }
        if (statement instanceof SQLReplaceStatement) {
            return replace((SQLReplaceStatement) statement);
        }
        if (statement instanceof SQLInsertStatement) {
            return insert((SQLInsertStatement) statement);
        }
        if (statement instanceof SQLUpdateStatement) {
            return update((SQLUpdateStatement) statement);
        }
        if (statement instanceof SQLDeleteStatement) {
            return delete((SQLDeleteStatement) statement, deleteReturning);
        }
        throw unsupported("statement " + statement.getClass().getSimpleName());
    }

    // statements

    private InsertStatement insert(SQLInsertStatement insert) throws UnsupportedConstructException {
        guard.checkInsert(insert);
        QualifiedName table = qualifiedName(insert.getTableSource().getExpr());
        List<QualifiedName> columns = names(insert.getColumns());
        List<ExpressionList> rows = rows(insert.getValuesList());
        Query query = insert.getQuery() == null ? null : query(insert.getQuery());

        boolean ignore = false;
        List<Assignment> onDuplicate = new ArrayList<>();
        if (insert instanceof MySqlInsertStatement) {
            MySqlInsertStatement mysql = (MySqlInsertStatement) insert;
            ignore = mysql.isIgnore();
            for (SQLExpr item : mysql.getDuplicateKeyUpdate()) {
                onDuplicate.add(assignment(item));
            }
        }

        OnConflict onConflict = null;
        List<Expression> returning = new ArrayList<>();
        if (insert instanceof PGInsertStatement) {
            PGInsertStatement pg = (PGInsertStatement) insert;
            onConflict = onConflict(pg);
            SQLExpr items = pg.getReturning();
            if (items instanceof SQLListExpr) {
                returning = exprs(((SQLListExpr) items).getItems());
            } else if (items != null) {
                returning.add(expr(items));
            }
        }
        return new InsertStatement(InsertStatement.Verb.INSERT, ignore, table, columns, rows, query,
                rows.isEmpty() && query == null, onDuplicate, onConflict, returning);
    }

    private OnConflict onConflict(PGInsertStatement insert) throws UnsupportedConstructException {
        List<SQLUpdateSetItem> setItems = insert.getOnConflictUpdateSetItems();
        boolean doUpdate = setItems != null && !setItems.isEmpty();
        if (!insert.isOnConflictDoNothing() && !doUpdate) {
            return null;
        }
        List<Expression> target = exprs(insert.getOnConflictTarget());
        QualifiedName constraint = insert.getOnConflictConstraint() == null
                ? null
                : qualifiedName(insert.getOnConflictConstraint());
        Expression targetWhere = expr(insert.getOnConflictWhere());
        if (!doUpdate) {
            return new OnConflict(target, constraint, targetWhere, OnConflict.Action.DO_NOTHING, List.of(), null);
        }
        return new OnConflict(target, constraint, targetWhere, OnConflict.Action.DO_UPDATE,
                assignments(setItems), expr(insert.getOnConflictUpdateWhere()));
    }

    private InsertStatement replace(SQLReplaceStatement replace) throws UnsupportedConstructException {
        QualifiedName table = qualifiedName(replace.getTableSource().getExpr());
        List<QualifiedName> columns = names(replace.getColumns());
        List<ExpressionList> rows = rows(replace.getValuesList());

        SQLObject source = replace.getQuery();
        Query query = null;
        if (source instanceof SQLQueryExpr) {
            query = query(((SQLQueryExpr) source).getSubQuery());
        } else if (source instanceof SQLSelect) {
            query = query((SQLSelect) source);
        }
        return new InsertStatement(InsertStatement.Verb.REPLACE, false, table, columns, rows, query,
                rows.isEmpty() && query == null, List.of());
    }

    private UpdateStatement update(SQLUpdateStatement update) throws UnsupportedConstructException {
        guard.checkUpdate(update);
        Relation target = relation(update.getTableSource());
        List<Assignment> assignments = assignments(update.getItems());
        Relation from = relation(update.getFrom());
        Expression where = expr(update.getWhere());

        OrderBy orderBy = null;
        Limit limit = null;
        if (update instanceof MySqlUpdateStatement) {
            MySqlUpdateStatement mysql = (MySqlUpdateStatement) update;
            orderBy = orderBy(mysql.getOrderBy());
            limit = limit(mysql.getLimit());
        }
        return new UpdateStatement(target, assignments, from, where, orderBy, limit, exprs(update.getReturning()));
    }

    private List<Assignment> assignments(List<SQLUpdateSetItem> items) throws UnsupportedConstructException {
        List<Assignment> assignments = new ArrayList<>();
        for (SQLUpdateSetItem item : items) {
            assignments.add(new Assignment(qualifiedName(item.getColumn()), expr(item.getValue())));
        }
        return assignments;
    }

    private DeleteStatement delete(SQLDeleteStatement delete, List<SQLExpr> trailingReturning)
            throws UnsupportedConstructException {
        guard.checkDelete(delete);
        Relation target = relation(delete.getTableSource());
        Expression where = expr(delete.getWhere());

        OrderBy orderBy = null;
        Limit limit = null;
        if (delete instanceof MySqlDeleteStatement) {
            MySqlDeleteStatement mysql = (MySqlDeleteStatement) delete;
            orderBy = orderBy(mysql.getOrderBy());
            limit = limit(mysql.getLimit());
        }
        List<Expression> returning = exprs(trailingReturning);
        if (returning.isEmpty() && delete instanceof PGDeleteStatement && ((PGDeleteStatement) delete).isReturning()) {
            returning.add(new AllColumns(null));
        }
        return new DeleteStatement(target, where, orderBy, limit, returning);
    }

    private List<ExpressionList> rows(List<SQLInsertStatement.ValuesClause> valuesList)
            throws UnsupportedConstructException {
        List<ExpressionList> rows = new ArrayList<>();
        if (valuesList != null) {
            for (SQLInsertStatement.ValuesClause values : valuesList) {
                rows.add(new ExpressionList(exprs(values.getValues())));
            }
        }
        return rows;
    }

    private Assignment assignment(SQLExpr item) throws UnsupportedConstructException {
        if (item instanceof SQLBinaryOpExpr && ((SQLBinaryOpExpr) item).getOperator() == SQLBinaryOperator.Equality) {
            SQLBinaryOpExpr binary = (SQLBinaryOpExpr) item;
            return new Assignment(qualifiedName(binary.getLeft()), expr(binary.getRight()));
        }
        throw unsupported("assignment " + render(item));
    }

    // queries

    private Query query(SQLSelect select) throws UnsupportedConstructException {
        guard.checkSelect(select);
        With with = select.getWithSubQuery() == null ? null : with(select.getWithSubQuery());
        QueryBody body = queryBody(select.getQuery());
        OrderBy orderBy = orderBy(select.getOrderBy());
        Limit limit = limit(select.getLimit());
        if (limit == null && (select.getRowCount() != null || select.getOffset() != null)) {
            limit = new Limit(expr(select.getRowCount()), expr(select.getOffset()), Limit.Style.OFFSET_FETCH);
        }

        if (body instanceof Query) {
            Query inner = (Query) body;
            boolean mergeable = (orderBy == null && limit == null)
                    || (inner.getLimit() == null && (orderBy == null || inner.getOrderBy() == null));
            if (inner.getWith() == null && mergeable) {
                return new Query(with, inner.getBody(),
                        orderBy != null ? orderBy : inner.getOrderBy(),
                        limit != null ? limit : inner.getLimit());
            }
        }
        return new Query(with, body, orderBy, limit);
    }

    private QueryBody queryBody(SQLSelectQuery query) throws UnsupportedConstructException {
        if (query instanceof SQLSelectQueryBlock) {
            SQLSelectQueryBlock block = (SQLSelectQueryBlock) query;
            Select select = select(block);
            return withOrdering(select, orderBy(block.getOrderBy()), blockLimit(block));
        }
        if (query instanceof SQLUnionQuery) {
            SQLUnionQuery union = (SQLUnionQuery) query;
            QueryBody left = queryBody(union.getLeft());
            QueryBody right = queryBody(union.getRight());
            SetOperation operation = new SetOperation(setOperator(union.getOperator()), left, right);
            return withOrdering(operation, orderBy(union.getOrderBy()), limit(union.getLimit()));
        }
        throw unsupported("query " + (query == null ? "null" : query.getClass().getSimpleName()));
    }

    private static QueryBody withOrdering(QueryBody body, OrderBy orderBy, Limit limit) {
        if (orderBy == null && limit == null) {
            return body;
        }
        return new Query(null, body, orderBy, limit);
    }

    private SetOperation.Operator setOperator(SQLUnionOperator operator) throws UnsupportedConstructException {
        switch (operator) {
            case UNION:
                return SetOperation.Operator.UNION;
            case UNION_ALL:
                return SetOperation.Operator.UNION_ALL;
            case INTERSECT:
                return SetOperation.Operator.INTERSECT;
            case EXCEPT:
                return SetOperation.Operator.EXCEPT;
            case MINUS:
                return SetOperation.Operator.MINUS;
            default:
                throw unsupported("set operator " + operator);
        }
    }

    private With with(SQLWithSubqueryClause clause) throws UnsupportedConstructException {
        boolean recursive = render(clause).toUpperCase(Locale.ROOT).startsWith("WITH RECURSIVE");
        List<CommonTableExpression> tables = new ArrayList<>();
        for (SQLWithSubqueryClause.Entry entry : clause.getEntries()) {
            List<Identifier> columns = new ArrayList<>();
            for (SQLName column : entry.getColumns()) {
                columns.add(qualifiedName(column).getLast());
            }
            tables.add(new CommonTableExpression(Identifier.parse(entry.getAlias()), columns,
                    query(entry.getSubQuery())));
        }
        return new With(recursive, tables);
    }

    private Select select(SQLSelectQueryBlock block) throws UnsupportedConstructException {
        guard.checkQueryBlock(block);

        int quantifier = block.getDistionOption();
        boolean distinct = quantifier == SQLSetQuantifier.DISTINCT || quantifier == SQLSetQuantifier.DISTINCTROW
                || quantifier == SQLSetQuantifier.UNIQUE;
        List<Expression> distinctOn = List.of();
        boolean forUpdate = block.isForUpdate();
        if (block instanceof PGSelectQueryBlock) {
            PGSelectQueryBlock pg = (PGSelectQueryBlock) block;
            distinctOn = exprs(pg.getDistinctOn());
            forUpdate = forUpdate || pg.getForClause() != null;
        }

        Top top = null;
        if (block instanceof SQLServerSelectQueryBlock) {
            SQLServerTop serverTop = ((SQLServerSelectQueryBlock) block).getTop();
            if (serverTop != null) {
                top = new Top(expr(serverTop.getExpr()), serverTop.isPercent(), serverTop.isWithTies());
            }
        }

        List<SelectItem> items = new ArrayList<>();
        for (SQLSelectItem item : block.getSelectList()) {
            items.add(new SelectItem(expr(item.getExpr()), alias(item.getAlias(), true)));
        }

        Relation from = relation(block.getFrom());
        Expression where = expr(block.getWhere());

        GroupBy groupBy = null;
        Expression having = null;
        SQLSelectGroupByClause group = block.getGroupBy();
        if (group != null) {
            if (!group.getItems().isEmpty()) {
                groupBy = new GroupBy(exprs(group.getItems()));
            }
            having = expr(group.getHaving());
        }
        return new Select(distinct, distinctOn, top, items, from, where, groupBy, having, forUpdate);
    }

    private OrderBy orderBy(SQLOrderBy orderBy) throws UnsupportedConstructException {
        if (orderBy == null || orderBy.getItems().isEmpty()) {
            return null;
        }
        List<SortItem> items = new ArrayList<>();
        for (SQLSelectOrderByItem item : orderBy.getItems()) {
            SortItem.Ordering ordering = SortItem.Ordering.UNSPECIFIED;
            if (item.getType() == SQLOrderingSpecification.ASC) {
                ordering = SortItem.Ordering.ASC;
            } else if (item.getType() == SQLOrderingSpecification.DESC) {
                ordering = SortItem.Ordering.DESC;
            }
            SortItem.NullOrdering nulls = SortItem.NullOrdering.UNSPECIFIED;
            if (item.getNullsOrderType() == SQLSelectOrderByItem.NullsOrderType.NullsFirst) {
                nulls = SortItem.NullOrdering.FIRST;
            } else if (item.getNullsOrderType() == SQLSelectOrderByItem.NullsOrderType.NullsLast) {
                nulls = SortItem.NullOrdering.LAST;
            }
            items.add(new SortItem(expr(item.getExpr()), ordering, nulls));
        }
        return new OrderBy(items);
    }

    private Limit limit(SQLLimit limit) throws UnsupportedConstructException {
        if (limit == null) {
            return null;
        }
        Expression rowCount = expr(limit.getRowCount());
        Expression offset = expr(limit.getOffset());
        if (rowCount == null && offset == null) {
            return null;
        }
        return new Limit(rowCount, offset, Limit.Style.LIMIT_OFFSET);
    }

    /**
     * LIMIT/OFFSET of a query block, with a PostgreSQL FETCH FIRST count
     * taking the row count's place.
     */
    private Limit blockLimit(SQLSelectQueryBlock block) throws UnsupportedConstructException {
        Limit limit = limit(block.getLimit());
        if (!(block instanceof PGSelectQueryBlock) || ((PGSelectQueryBlock) block).getFetch() == null) {
            return limit;
        }
        Expression fetchCount = expr(((PGSelectQueryBlock) block).getFetch().getCount());
        if (limit != null && limit.getRowCount() != null) {
            throw unsupported("LIMIT together with FETCH");
        }
        return new Limit(fetchCount, limit == null ? null : limit.getOffset(), Limit.Style.OFFSET_FETCH);
    }

    // relations

    private Relation relation(SQLTableSource source) throws UnsupportedConstructException {
        if (source == null) {
            return null;
        }
        guard.checkTableSource(source);
        if (source instanceof SQLExprTableSource) {
            SQLExprTableSource table = (SQLExprTableSource) source;
            return new Table(qualifiedName(table.getExpr()), alias(table.getAlias(), false));
        }
        if (source instanceof SQLJoinTableSource) {
            return join((SQLJoinTableSource) source);
        }
        if (source instanceof SQLSubqueryTableSource) {
            SQLSubqueryTableSource subquery = (SQLSubqueryTableSource) source;
            return new DerivedTable(query(subquery.getSelect()), alias(subquery.getAlias(), false));
        }
        if (source instanceof SQLUnionQueryTableSource) {
            SQLUnionQueryTableSource union = (SQLUnionQueryTableSource) source;
            QueryBody body = queryBody(union.getUnion());
            Query query = body instanceof Query ? (Query) body : Query.simple(body);
            return new DerivedTable(query, alias(union.getAlias(), false));
        }
        throw unsupported("table source " + source.getClass().getSimpleName());
    }

    private Join join(SQLJoinTableSource join) throws UnsupportedConstructException {
        Join.Type type;
        boolean spelled = false;
        switch (join.getJoinType()) {
            case COMMA:
                type = Join.Type.COMMA;
                break;
            case JOIN:
                type = Join.Type.INNER;
                break;
            case INNER_JOIN:
                type = Join.Type.INNER;
                spelled = true;
                break;
            case CROSS_JOIN:
                type = Join.Type.CROSS;
                break;
            case LEFT_OUTER_JOIN:
                type = Join.Type.LEFT;
                break;
            case RIGHT_OUTER_JOIN:
                type = Join.Type.RIGHT;
                break;
            case FULL_OUTER_JOIN:
                type = Join.Type.FULL;
                break;
            case NATURAL_JOIN:
                type = Join.Type.NATURAL;
                break;
            default:
                throw unsupported("join type " + join.getJoinType());
        }

        Relation left = relation(join.getLeft());
        Relation right = relation(join.getRight());
        Expression condition = expr(join.getCondition());
        List<Identifier> using = new ArrayList<>();
        for (SQLExpr column : join.getUsing()) {
            using.add(qualifiedName(column).getLast());
        }
        return new Join(type, spelled, left, right, condition, using);
    }

    private static Alias alias(String raw, boolean explicitAs) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return new Alias(Identifier.parse(raw), explicitAs);
    }

    // names

    private QualifiedName qualifiedName(SQLExpr expr) throws UnsupportedConstructException {
        if (expr instanceof SQLIdentifierExpr) {
            return QualifiedName.of(Identifier.parse(((SQLIdentifierExpr) expr).getName()));
        }
        if (expr instanceof SQLPropertyExpr) {
            SQLPropertyExpr property = (SQLPropertyExpr) expr;
            List<Identifier> parts = new ArrayList<>();
            if (property.getOwner() != null) {
                parts.addAll(qualifiedName(property.getOwner()).getParts());
            }
            parts.add(Identifier.parse(property.getName()));
            return new QualifiedName(parts);
        }
        throw unsupported("name " + (expr == null ? "null" : render(expr)));
    }

    private List<QualifiedName> names(List<? extends SQLExpr> exprs) throws UnsupportedConstructException {
        List<QualifiedName> names = new ArrayList<>();
        if (exprs != null) {
            for (SQLExpr expr : exprs) {
                names.add(qualifiedName(expr));
            }
        }
        return names;
    }

    // expressions

    private List<Expression> exprs(List<? extends SQLExpr> exprs) throws UnsupportedConstructException {
        List<Expression> result = new ArrayList<>();
        if (exprs != null) {
            for (SQLExpr expr : exprs) {
                result.add(expr(expr));
            }
        }
        return result;
    }

    private Expression expr(SQLExpr expr) throws UnsupportedConstructException {
        if (expr == null) {
            return null;
        }

        LiteralKind literalKind = LITERAL_TYPES.get(expr.getClass().getSimpleName());
        if (literalKind != null) {
            return literal(expr, literalKind);
        }
        if (KEYWORD_TYPES.contains(expr.getClass().getSimpleName())) {
            return new KeywordExpression(render(expr));
        }

        if (expr instanceof SQLIdentifierExpr) {
            return new ColumnReference(qualifiedName(expr));
        }
        if (expr instanceof SQLPropertyExpr) {
            SQLPropertyExpr property = (SQLPropertyExpr) expr;
            if ("*".equals(property.getName())) {
                return new AllColumns(qualifiedName(property.getOwner()));
            }
            return new ColumnReference(qualifiedName(expr));
        }
        if (expr instanceof SQLAllColumnExpr) {
            return new AllColumns(null);
        }
        if (expr instanceof SQLVariantRefExpr) {
            return new BindParameter(((SQLVariantRefExpr) expr).getName());
        }
        if (expr instanceof SQLBinaryOpExpr) {
            return binary((SQLBinaryOpExpr) expr);
        }
        if (expr instanceof SQLBinaryOpExprGroup) {
            SQLBinaryOpExprGroup group = (SQLBinaryOpExprGroup) expr;
            BinaryOperator operator = binaryOperator(group.getOperator());
            Expression result = null;
            for (SQLExpr item : group.getItems()) {
                Expression next = expr(item);
                result = result == null ? next : new BinaryOperation(operator, result, next);
            }
            return result;
        }
        if (expr instanceof SQLUnaryExpr) {
            SQLUnaryExpr unary = (SQLUnaryExpr) expr;
            return new UnaryOperation(unaryOperator(unary.getOperator().name), expr(unary.getExpr()));
        }
        if (expr instanceof SQLNotExpr) {
            return new UnaryOperation(UnaryOperator.NOT, expr(((SQLNotExpr) expr).getExpr()));
        }
        if (expr instanceof SQLInListExpr) {
            SQLInListExpr in = (SQLInListExpr) expr;
            return new InListPredicate(expr(in.getExpr()), in.isNot(), new ExpressionList(exprs(in.getTargetList())));
        }
        if (expr instanceof SQLInSubQueryExpr) {
            SQLInSubQueryExpr in = (SQLInSubQueryExpr) expr;
            return new InSubqueryPredicate(expr(in.getExpr()), in.isNot(), query(in.getSubQuery()));
        }
        if (expr instanceof SQLExistsExpr) {
            SQLExistsExpr exists = (SQLExistsExpr) expr;
            return new ExistsPredicate(exists.isNot(), query(exists.getSubQuery()));
        }
        if (expr instanceof SQLQueryExpr) {
            return new SubqueryExpression(query(((SQLQueryExpr) expr).getSubQuery()));
        }
        if (expr instanceof SQLAnyExpr) {
            return new QuantifiedSubquery(QuantifiedSubquery.Quantifier.ANY, query(((SQLAnyExpr) expr).getSubQuery()));
        }
        if (expr instanceof SQLSomeExpr) {
            return new QuantifiedSubquery(QuantifiedSubquery.Quantifier.SOME, query(((SQLSomeExpr) expr).getSubQuery()));
        }
        if (expr instanceof SQLAllExpr) {
            return new QuantifiedSubquery(QuantifiedSubquery.Quantifier.ALL, query(((SQLAllExpr) expr).getSubQuery()));
        }
        if (expr instanceof SQLBetweenExpr) {
            SQLBetweenExpr between = (SQLBetweenExpr) expr;
            return new BetweenPredicate(expr(between.getTestExpr()), between.isNot(),
                    expr(between.getBeginExpr()), expr(between.getEndExpr()));
        }
        if (expr instanceof SQLCaseExpr) {
            SQLCaseExpr caseExpr = (SQLCaseExpr) expr;
            Expression operand = expr(caseExpr.getValueExpr());
            List<WhenClause> whenClauses = new ArrayList<>();
            for (SQLCaseExpr.Item item : caseExpr.getItems()) {
                whenClauses.add(new WhenClause(expr(item.getConditionExpr()), expr(item.getValueExpr())));
            }
            return new CaseExpression(operand, whenClauses, expr(caseExpr.getElseExpr()));
        }
        if (expr instanceof SQLMethodInvokeExpr) {
            return function((SQLMethodInvokeExpr) expr);
        }
        if (expr instanceof SQLCastExpr) {
            SQLCastExpr cast = (SQLCastExpr) expr;
            String type = render(cast.getDataType()).replaceAll("\\s+", " ");
            return new CastExpression(expr(cast.getExpr()), new DataType(type));
        }
        if (expr instanceof SQLExtractExpr) {
            SQLExtractExpr extract = (SQLExtractExpr) expr;
            return new ExtractExpression(extract.getUnit().name(), expr(extract.getValue()));
        }
        if (expr instanceof SQLArrayExpr) {
            return new ArrayConstructor(exprs(((SQLArrayExpr) expr).getValues()));
        }
        if (expr instanceof SQLListExpr) {
            return new ExpressionList(exprs(((SQLListExpr) expr).getItems()));
        }
        throw unsupported("expression " + expr.getClass().getSimpleName());
    }

    private Expression binary(SQLBinaryOpExpr binary) throws UnsupportedConstructException {
        SQLBinaryOperator operator = binary.getOperator();
        if (operator == SQLBinaryOperator.Is || operator == SQLBinaryOperator.IsNot) {
            IsPredicate.Target target = isTarget(binary.getRight());
            if (target != null) {
                return new IsPredicate(expr(binary.getLeft()), operator == SQLBinaryOperator.IsNot, target);
            }
        }
        Expression left = expr(binary.getLeft());
        Expression right = expr(binary.getRight());
        return new BinaryOperation(binaryOperator(operator), left, right);
    }

    private IsPredicate.Target isTarget(SQLExpr right) {
        String type = right.getClass().getSimpleName();
        if ("SQLNullExpr".equals(type)) {
            return IsPredicate.Target.NULL;
        }
        String word = render(right).toUpperCase(Locale.ROOT);
        if ("SQLBooleanExpr".equals(type) || right instanceof SQLIdentifierExpr) {
            switch (word) {
                case "TRUE":
                    return IsPredicate.Target.TRUE;
                case "FALSE":
                    return IsPredicate.Target.FALSE;
                case "UNKNOWN":
                    return IsPredicate.Target.UNKNOWN;
                case "NULL":
                    return IsPredicate.Target.NULL;
                default:
                    return null;
            }
        }
        return null;
    }

    private BinaryOperator binaryOperator(SQLBinaryOperator operator) throws UnsupportedConstructException {
        BinaryOperator result = BinaryOperator.fromSymbol(operator.name);
        if (result == null) {
            throw unsupported("operator " + operator.name);
        }
        return result;
    }

    private UnaryOperator unaryOperator(String symbol) throws UnsupportedConstructException {
        switch (symbol.toUpperCase(Locale.ROOT)) {
            case "NOT":
            case "!":
                return UnaryOperator.NOT;
            case "-":
                return UnaryOperator.MINUS;
            case "+":
                return UnaryOperator.PLUS;
            case "~":
                return UnaryOperator.BITWISE_NOT;
            default:
                throw unsupported("unary operator " + symbol);
        }
    }

    private FunctionCall function(SQLMethodInvokeExpr call) throws UnsupportedConstructException {
        guard.checkMethod(call);

        List<Identifier> name = new ArrayList<>();
        if (call.getOwner() != null) {
            name.addAll(qualifiedName(call.getOwner()).getParts());
        }
        name.add(Identifier.parse(call.getMethodName()));

        boolean distinct = false;
        Expression filter = null;
        WindowSpecification window = null;
        if (call instanceof SQLAggregateExpr) {
            SQLAggregateExpr aggregate = (SQLAggregateExpr) call;
            guard.checkAggregate(aggregate);
            SQLAggregateOption option = aggregate.getOption();
            if (option == SQLAggregateOption.DISTINCT) {
                distinct = true;
            } else if (option != null && option != SQLAggregateOption.ALL) {
                throw unsupported("aggregate option " + option);
            }
            filter = expr(aggregate.getFilter());
            window = window(aggregate.getOver());
        }
        List<Expression> arguments = exprs(call.getArguments());
        return new FunctionCall(new QualifiedName(name), distinct, arguments, filter, window);
    }

    private WindowSpecification window(SQLOver over) throws UnsupportedConstructException {
        if (over == null) {
            return null;
        }
        return new WindowSpecification(exprs(over.getPartitionBy()), orderBy(over.getOrderBy()));
    }

    /**
     * Numbers and plain strings keep their source spelling. The other
     * literal kinds use Druid's rendering.
     */
    private Literal literal(SQLExpr expr, LiteralKind kind) {
        switch (kind) {
            case NUMERIC:
                if (expr instanceof SQLIntegerExpr || expr instanceof SQLNumberExpr) {
                    String text = source.takeNumber(((SQLNumericLiteralExpr) expr).getNumber());
                    return new Literal(kind, text != null ? text : render(expr));
                }
                return new Literal(kind, render(expr));
            case STRING:
                if (expr.getClass() == SQLCharExpr.class) {
                    String value = ((SQLCharExpr) expr).getText();
                    String text = source.takeString(value, false);
                    return new Literal(kind, text != null ? text : quote(value));
                }
                if (expr instanceof SQLNCharExpr) {
                    String value = ((SQLNCharExpr) expr).getText();
                    String text = source.takeString(value, true);
                    return new Literal(kind, text != null ? text : "N" + quote(value));
                }
                return new Literal(kind, render(expr));
            case BOOLEAN:
            case NULL:
                return new Literal(kind, render(expr).toUpperCase(Locale.ROOT));
            case TEMPORAL:
                takeTemporalValue(expr);
                return new Literal(kind, render(expr));
            default:
                return new Literal(kind, render(expr));
        }
    }

    // the quoted value inside a temporal literal must not be matched by a later string or number
    private void takeTemporalValue(SQLExpr temporal) {
        Object value = null;
        if (temporal instanceof SQLDateExpr) {
            value = ((SQLDateExpr) temporal).getLiteral();
        } else if (temporal instanceof SQLTimestampExpr) {
            value = ((SQLTimestampExpr) temporal).getLiteral();
        } else if (temporal instanceof SQLTimeExpr) {
            value = ((SQLTimeExpr) temporal).getLiteral();
        } else if (temporal instanceof SQLDateTimeExpr) {
            value = ((SQLDateTimeExpr) temporal).getLiteral();
        } else if (temporal instanceof SQLIntervalExpr) {
            value = ((SQLIntervalExpr) temporal).getValue();
        } else if (temporal instanceof OracleIntervalExpr) {
            value = ((OracleIntervalExpr) temporal).getValue();
        }

        if (value instanceof String) {
            source.takeString((String) value, false);
        } else if (value instanceof SQLCharExpr) {
            source.takeString(((SQLCharExpr) value).getText(), false);
        } else if (value instanceof SQLNumericLiteralExpr) {
            source.takeNumber(((SQLNumericLiteralExpr) value).getNumber());
        }
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private String render(SQLObject node) {
        return SQLUtils.toSQLString(node, dbType).trim();
    }

    private UnsupportedConstructException unsupported(String construct) {
        return new UnsupportedConstructException(construct, dialect);
    }
}
