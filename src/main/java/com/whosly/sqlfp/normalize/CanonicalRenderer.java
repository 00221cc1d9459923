package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.tree.Alias;
import com.whosly.sqlfp.tree.AllColumns;
import com.whosly.sqlfp.tree.ArrayConstructor;
import com.whosly.sqlfp.tree.Assignment;
import com.whosly.sqlfp.tree.BetweenPredicate;
import com.whosly.sqlfp.tree.BinaryOperation;
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
import com.whosly.sqlfp.tree.OnConflict;
import com.whosly.sqlfp.tree.OrderBy;
import com.whosly.sqlfp.tree.Parenthesized;
import com.whosly.sqlfp.tree.Placeholder;
import com.whosly.sqlfp.tree.QualifiedName;
import com.whosly.sqlfp.tree.QuantifiedSubquery;
import com.whosly.sqlfp.tree.Query;
import com.whosly.sqlfp.tree.QueryBody;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectItem;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.SetOperation;
import com.whosly.sqlfp.tree.SortItem;
import com.whosly.sqlfp.tree.SqlNode;
import com.whosly.sqlfp.tree.SqlNodeVisitor;
import com.whosly.sqlfp.tree.SubqueryExpression;
import com.whosly.sqlfp.tree.Table;
import com.whosly.sqlfp.tree.Top;
import com.whosly.sqlfp.tree.UnaryOperation;
import com.whosly.sqlfp.tree.UpdateStatement;
import com.whosly.sqlfp.tree.WhenClause;
import com.whosly.sqlfp.tree.WindowSpecification;
import com.whosly.sqlfp.tree.With;

import java.util.List;

/**
 * Serializes a tree into one line of canonical SQL.
 *
 * Keywords are uppercase, tokens are separated by exactly one space and a
 * comma is followed by one space. Children are emitted in the order
 * {@link com.whosly.sqlfp.tree.TreeRewriter} visits them. Instances hold
 * per-call state and must not be shared.
 */
public class CanonicalRenderer implements SqlNodeVisitor<Void> {

    private final StringBuilder out = new StringBuilder();

    public String render(SqlNode node) {
        out.setLength(0);
        node.accept(this);
        return out.toString();
    }

    private void process(SqlNode node) {
        node.accept(this);
    }

    private CanonicalRenderer append(String text) {
        out.append(text);
        return this;
    }

    private void commaSeparated(List<? extends SqlNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            process(nodes.get(i));
        }
    }

    private void parenthesizedQuery(Query query) {
        out.append('(');
        process(query);
        out.append(')');
    }

    // statements

    @Override
    public Void visitSelectStatement(SelectStatement node) {
        process(node.getQuery());
        return null;
    }

    @Override
    public Void visitInsertStatement(InsertStatement node) {
        append(node.getVerb().name());
        if (node.isIgnore()) {
            append(" IGNORE");
        }
        append(" INTO ");
        process(node.getTable());
        if (!node.getColumns().isEmpty()) {
            append(" (");
            commaSeparated(node.getColumns());
            append(")");
        }
        if (!node.getRows().isEmpty()) {
            append(" VALUES ");
            commaSeparated(node.getRows());
        }
        if (node.getQuery() != null) {
            append(" ");
            process(node.getQuery());
        }
        if (node.isDefaultValues()) {
            append(" DEFAULT VALUES");
        }
        if (!node.getOnDuplicateKeyUpdate().isEmpty()) {
            append(" ON DUPLICATE KEY UPDATE ");
            commaSeparated(node.getOnDuplicateKeyUpdate());
        }
        if (node.getOnConflict() != null) {
            append(" ");
            process(node.getOnConflict());
        }
        returning(node.getReturning());
        return null;
    }

    private void returning(List<Expression> returning) {
        if (!returning.isEmpty()) {
            append(" RETURNING ");
            commaSeparated(returning);
        }
    }

    @Override
    public Void visitOnConflict(OnConflict node) {
        append("ON CONFLICT");
        if (!node.getTarget().isEmpty()) {
            append(" (");
            commaSeparated(node.getTarget());
            append(")");
        }
        if (node.getConstraint() != null) {
            append(" ON CONSTRAINT ");
            process(node.getConstraint());
        }
        if (node.getTargetWhere() != null) {
            append(" WHERE ");
            process(node.getTargetWhere());
        }
        if (node.getAction() == OnConflict.Action.DO_NOTHING) {
            append(" DO NOTHING");
            return null;
        }
        append(" DO UPDATE SET ");
        commaSeparated(node.getAssignments());
        if (node.getWhere() != null) {
            append(" WHERE ");
            process(node.getWhere());
        }
        return null;
    }

    @Override
    public Void visitUpdateStatement(UpdateStatement node) {
        append("UPDATE ");
        process(node.getTarget());
        append(" SET ");
        commaSeparated(node.getAssignments());
        if (node.getFrom() != null) {
            append(" FROM ");
            process(node.getFrom());
        }
        if (node.getWhere() != null) {
            append(" WHERE ");
            process(node.getWhere());
        }
        if (node.getOrderBy() != null) {
            append(" ");
            process(node.getOrderBy());
        }
        if (node.getLimit() != null) {
            append(" ");
            process(node.getLimit());
        }
        returning(node.getReturning());
        return null;
    }

    @Override
    public Void visitDeleteStatement(DeleteStatement node) {
        append("DELETE FROM ");
        process(node.getTarget());
        if (node.getWhere() != null) {
            append(" WHERE ");
            process(node.getWhere());
        }
        if (node.getOrderBy() != null) {
            append(" ");
            process(node.getOrderBy());
        }
        if (node.getLimit() != null) {
            append(" ");
            process(node.getLimit());
        }
        returning(node.getReturning());
        return null;
    }

    // query structure

    @Override
    public Void visitQuery(Query node) {
        if (node.getWith() != null) {
            process(node.getWith());
            append(" ");
        }
        if (node.getBody() instanceof Query) {
            parenthesizedQuery((Query) node.getBody());
        } else {
            process(node.getBody());
        }
        if (node.getOrderBy() != null) {
            append(" ");
            process(node.getOrderBy());
        }
        if (node.getLimit() != null) {
            append(" ");
            process(node.getLimit());
        }
        return null;
    }

    @Override
    public Void visitWith(With node) {
        append(node.isRecursive() ? "WITH RECURSIVE " : "WITH ");
        commaSeparated(node.getTables());
        return null;
    }

    @Override
    public Void visitCommonTableExpression(CommonTableExpression node) {
        process(node.getName());
        if (!node.getColumns().isEmpty()) {
            append(" (");
            commaSeparated(node.getColumns());
            append(")");
        }
        append(" AS ");
        parenthesizedQuery(node.getQuery());
        return null;
    }

    @Override
    public Void visitSelect(Select node) {
        append("SELECT ");
        if (!node.getDistinctOn().isEmpty()) {
            append("DISTINCT ON (");
            commaSeparated(node.getDistinctOn());
            append(") ");
        } else if (node.isDistinct()) {
            append("DISTINCT ");
        }
        if (node.getTop() != null) {
            process(node.getTop());
            append(" ");
        }
        commaSeparated(node.getItems());
        if (node.getFrom() != null) {
            append(" FROM ");
            process(node.getFrom());
        }
        if (node.getWhere() != null) {
            append(" WHERE ");
            process(node.getWhere());
        }
        if (node.getGroupBy() != null) {
            append(" ");
            process(node.getGroupBy());
        }
        if (node.getHaving() != null) {
            append(" HAVING ");
            process(node.getHaving());
        }
        if (node.isForUpdate()) {
            append(" FOR UPDATE");
        }
        return null;
    }

    @Override
    public Void visitSetOperation(SetOperation node) {
        setOperand(node.getLeft(), node.getOperator(), false);
        append(" ").append(node.getOperator().getKeyword()).append(" ");
        setOperand(node.getRight(), node.getOperator(), true);
        return null;
    }

    private void setOperand(QueryBody operand, SetOperation.Operator parent, boolean right) {
        boolean nestedSet = operand instanceof SetOperation
                && (right || ((SetOperation) operand).getOperator() != parent);
        if (operand instanceof Query) {
            parenthesizedQuery((Query) operand);
        } else if (nestedSet) {
            append("(");
            process(operand);
            append(")");
        } else {
            process(operand);
        }
    }

    @Override
    public Void visitSelectItem(SelectItem node) {
        process(node.getExpression());
        alias(node.getAlias());
        return null;
    }

    private void alias(Alias alias) {
        if (alias != null) {
            append(alias.isExplicitAs() ? " AS " : " ");
            process(alias);
        }
    }

    @Override
    public Void visitAlias(Alias node) {
        process(node.getName());
        return null;
    }

    @Override
    public Void visitTop(Top node) {
        append("TOP ");
        process(node.getCount());
        if (node.isPercent()) {
            append(" PERCENT");
        }
        if (node.isWithTies()) {
            append(" WITH TIES");
        }
        return null;
    }

    @Override
    public Void visitGroupBy(GroupBy node) {
        append("GROUP BY ");
        commaSeparated(node.getItems());
        return null;
    }

    @Override
    public Void visitOrderBy(OrderBy node) {
        append("ORDER BY ");
        commaSeparated(node.getItems());
        return null;
    }

    @Override
    public Void visitSortItem(SortItem node) {
        process(node.getExpression());
        if (node.getOrdering() != SortItem.Ordering.UNSPECIFIED) {
            append(" ").append(node.getOrdering().name());
        }
        if (node.getNullOrdering() != SortItem.NullOrdering.UNSPECIFIED) {
            append(" NULLS ").append(node.getNullOrdering().name());
        }
        return null;
    }

    @Override
    public Void visitLimit(Limit node) {
        if (node.isOffsetFirst()) {
            if (node.getOffset() != null) {
                append("OFFSET ");
                process(node.getOffset());
                append(" ROWS");
            }
            if (node.getRowCount() != null) {
                append(node.getOffset() != null ? " FETCH NEXT " : "FETCH FIRST ");
                process(node.getRowCount());
                append(" ROWS ONLY");
            }
        } else {
            if (node.getRowCount() != null) {
                append("LIMIT ");
                process(node.getRowCount());
            }
            if (node.getOffset() != null) {
                append(node.getRowCount() != null ? " OFFSET " : "OFFSET ");
                process(node.getOffset());
            }
        }
        return null;
    }

    @Override
    public Void visitAssignment(Assignment node) {
        process(node.getTarget());
        append(" = ");
        process(node.getValue());
        return null;
    }

    // relations

    @Override
    public Void visitTable(Table node) {
        process(node.getName());
        alias(node.getAlias());
        return null;
    }

    @Override
    public Void visitDerivedTable(DerivedTable node) {
        parenthesizedQuery(node.getQuery());
        alias(node.getAlias());
        return null;
    }

    @Override
    public Void visitJoin(Join node) {
        process(node.getLeft());
        append(node.getType() == Join.Type.COMMA ? ", " : " " + joinKeyword(node) + " ");
        if (node.getRight() instanceof Join) {
            append("(");
            process(node.getRight());
            append(")");
        } else {
            process(node.getRight());
        }
        if (node.getCondition() != null) {
            append(" ON ");
            process(node.getCondition());
        }
        if (!node.getUsing().isEmpty()) {
            append(" USING (");
            commaSeparated(node.getUsing());
            append(")");
        }
        return null;
    }

    private static String joinKeyword(Join join) {
        switch (join.getType()) {
            case INNER:
                return join.isQualifierSpelled() ? "INNER JOIN" : "JOIN";
            case LEFT:
                return join.isQualifierSpelled() ? "LEFT OUTER JOIN" : "LEFT JOIN";
            case RIGHT:
                return join.isQualifierSpelled() ? "RIGHT OUTER JOIN" : "RIGHT JOIN";
            case FULL:
                return join.isQualifierSpelled() ? "FULL OUTER JOIN" : "FULL JOIN";
            case CROSS:
                return "CROSS JOIN";
            case NATURAL:
                return "NATURAL JOIN";
            default:
                return ",";
        }
    }

    // names and values

    @Override
    public Void visitIdentifier(Identifier node) {
        if (!node.isQuoted()) {
            append(node.getValue());
            return null;
        }
        char close = node.getQuoteStyle().getClose();
        out.append(node.getQuoteStyle().getOpen())
                .append(node.getValue().replace(String.valueOf(close), String.valueOf(close) + close))
                .append(close);
        return null;
    }

    @Override
    public Void visitQualifiedName(QualifiedName node) {
        List<Identifier> parts = node.getParts();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                out.append('.');
            }
            process(parts.get(i));
        }
        return null;
    }

    @Override
    public Void visitColumnReference(ColumnReference node) {
        process(node.getName());
        return null;
    }

    @Override
    public Void visitAllColumns(AllColumns node) {
        if (node.getQualifier() != null) {
            process(node.getQualifier());
            out.append('.');
        }
        out.append('*');
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        append(node.getText());
        return null;
    }

    @Override
    public Void visitPlaceholder(Placeholder node) {
        append(node.getText());
        return null;
    }

    @Override
    public Void visitBindParameter(BindParameter node) {
        append(node.getText());
        return null;
    }

    // operators and predicates

    @Override
    public Void visitBinaryOperation(BinaryOperation node) {
        process(node.getLeft());
        append(" ").append(node.getOperator().getSymbol()).append(" ");
        process(node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryOperation(UnaryOperation node) {
        append(node.getOperator().getSymbol());
        if (node.getOperator().isKeyword()) {
            append(" ");
        }
        process(node.getOperand());
        return null;
    }

    @Override
    public Void visitIsPredicate(IsPredicate node) {
        process(node.getOperand());
        append(node.isNegated() ? " IS NOT " : " IS ").append(node.getTarget().name());
        return null;
    }

    @Override
    public Void visitInListPredicate(InListPredicate node) {
        process(node.getOperand());
        append(node.isNegated() ? " NOT IN " : " IN ");
        process(node.getValues());
        return null;
    }

    @Override
    public Void visitInSubqueryPredicate(InSubqueryPredicate node) {
        process(node.getOperand());
        append(node.isNegated() ? " NOT IN " : " IN ");
        parenthesizedQuery(node.getSubquery());
        return null;
    }

    @Override
    public Void visitExistsPredicate(ExistsPredicate node) {
        append(node.isNegated() ? "NOT EXISTS " : "EXISTS ");
        parenthesizedQuery(node.getSubquery());
        return null;
    }

    @Override
    public Void visitBetweenPredicate(BetweenPredicate node) {
        process(node.getOperand());
        append(node.isNegated() ? " NOT BETWEEN " : " BETWEEN ");
        process(node.getLow());
        append(" AND ");
        process(node.getHigh());
        return null;
    }

    @Override
    public Void visitSubqueryExpression(SubqueryExpression node) {
        parenthesizedQuery(node.getQuery());
        return null;
    }

    @Override
    public Void visitQuantifiedSubquery(QuantifiedSubquery node) {
        append(node.getQuantifier().name()).append(" ");
        parenthesizedQuery(node.getQuery());
        return null;
    }

    // other expressions

    @Override
    public Void visitCaseExpression(CaseExpression node) {
        append("CASE");
        if (node.getOperand() != null) {
            append(" ");
            process(node.getOperand());
        }
        for (WhenClause when : node.getWhenClauses()) {
            append(" ");
            process(when);
        }
        if (node.getElseResult() != null) {
            append(" ELSE ");
            process(node.getElseResult());
        }
        append(" END");
        return null;
    }

    @Override
    public Void visitWhenClause(WhenClause node) {
        append("WHEN ");
        process(node.getCondition());
        append(" THEN ");
        process(node.getResult());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        process(node.getName());
        append("(");
        if (node.isDistinct()) {
            append("DISTINCT ");
        }
        commaSeparated(node.getArguments());
        append(")");
        if (node.getFilter() != null) {
            append(" FILTER (WHERE ");
            process(node.getFilter());
            append(")");
        }
        if (node.getWindow() != null) {
            append(" OVER (");
            process(node.getWindow());
            append(")");
        }
        return null;
    }

    @Override
    public Void visitWindowSpecification(WindowSpecification node) {
        if (!node.getPartitionBy().isEmpty()) {
            append("PARTITION BY ");
            commaSeparated(node.getPartitionBy());
        }
        if (node.getOrderBy() != null) {
            if (!node.getPartitionBy().isEmpty()) {
                append(" ");
            }
            process(node.getOrderBy());
        }
        return null;
    }

    @Override
    public Void visitCastExpression(CastExpression node) {
        append("CAST(");
        process(node.getOperand());
        append(" AS ");
        process(node.getType());
        append(")");
        return null;
    }

    @Override
    public Void visitDataType(DataType node) {
        append(node.getName());
        return null;
    }

    @Override
    public Void visitExtractExpression(ExtractExpression node) {
        append("EXTRACT(").append(node.getField()).append(" FROM ");
        process(node.getSource());
        append(")");
        return null;
    }

    @Override
    public Void visitArrayConstructor(ArrayConstructor node) {
        append("ARRAY[");
        commaSeparated(node.getElements());
        append("]");
        return null;
    }

    @Override
    public Void visitExpressionList(ExpressionList node) {
        append("(");
        commaSeparated(node.getItems());
        append(")");
        return null;
    }

    @Override
    public Void visitKeywordExpression(KeywordExpression node) {
        append(node.getKeyword());
        return null;
    }

    @Override
    public Void visitParenthesized(Parenthesized node) {
        append("(");
        process(node.getExpression());
        append(")");
        return null;
    }
}
