package com.whosly.sqlfp.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Copying visitor. Every method rebuilds its node from rewritten children,
 * so subclasses only override the node types they change.
 *
 * Children are visited in the order the canonical renderer emits them. A
 * rewriter that records something per node (such as extracted literals)
 * therefore sees nodes in output order.
 */
public abstract class TreeRewriter implements SqlNodeVisitor<SqlNode> {

    protected SqlNode rewrite(SqlNode node) {
        return node == null ? null : node.accept(this);
    }

    /**
     * Rewrite a child that must stay assignable to {@code type}.
     *
     * @throws ClassCastException if an override returned a node of another type
     */
    protected <T extends SqlNode> T rewrite(SqlNode node, Class<T> type) {
        return type.cast(rewrite(node));
    }

    protected <T extends SqlNode> List<T> rewriteAll(List<? extends SqlNode> nodes, Class<T> type) {
        List<T> result = new ArrayList<>(nodes.size());
        for (SqlNode node : nodes) {
            result.add(rewrite(node, type));
        }
        return result;
    }

    @Override
    public SqlNode visitSelectStatement(SelectStatement node) {
        return new SelectStatement(rewrite(node.getQuery(), Query.class));
    }

    @Override
    public SqlNode visitInsertStatement(InsertStatement node) {
        QualifiedName table = rewrite(node.getTable(), QualifiedName.class);
        List<QualifiedName> columns = rewriteAll(node.getColumns(), QualifiedName.class);
        List<ExpressionList> rows = rewriteAll(node.getRows(), ExpressionList.class);
        Query query = rewrite(node.getQuery(), Query.class);
        List<Assignment> onDuplicate = rewriteAll(node.getOnDuplicateKeyUpdate(), Assignment.class);
        OnConflict onConflict = rewrite(node.getOnConflict(), OnConflict.class);
        List<Expression> returning = rewriteAll(node.getReturning(), Expression.class);
        return new InsertStatement(node.getVerb(), node.isIgnore(), table, columns, rows, query,
                node.isDefaultValues(), onDuplicate, onConflict, returning);
    }

    @Override
    public SqlNode visitOnConflict(OnConflict node) {
        List<Expression> target = rewriteAll(node.getTarget(), Expression.class);
        QualifiedName constraint = rewrite(node.getConstraint(), QualifiedName.class);
        Expression targetWhere = rewrite(node.getTargetWhere(), Expression.class);
        List<Assignment> assignments = rewriteAll(node.getAssignments(), Assignment.class);
        Expression where = rewrite(node.getWhere(), Expression.class);
        return new OnConflict(target, constraint, targetWhere, node.getAction(), assignments, where);
    }

    @Override
    public SqlNode visitUpdateStatement(UpdateStatement node) {
        Relation target = rewrite(node.getTarget(), Relation.class);
        List<Assignment> assignments = rewriteAll(node.getAssignments(), Assignment.class);
        Relation from = rewrite(node.getFrom(), Relation.class);
        Expression where = rewrite(node.getWhere(), Expression.class);
        OrderBy orderBy = rewrite(node.getOrderBy(), OrderBy.class);
        Limit limit = rewrite(node.getLimit(), Limit.class);
        List<Expression> returning = rewriteAll(node.getReturning(), Expression.class);
        return new UpdateStatement(target, assignments, from, where, orderBy, limit, returning);
    }

    @Override
    public SqlNode visitDeleteStatement(DeleteStatement node) {
        Relation target = rewrite(node.getTarget(), Relation.class);
        Expression where = rewrite(node.getWhere(), Expression.class);
        OrderBy orderBy = rewrite(node.getOrderBy(), OrderBy.class);
        Limit limit = rewrite(node.getLimit(), Limit.class);
        List<Expression> returning = rewriteAll(node.getReturning(), Expression.class);
        return new DeleteStatement(target, where, orderBy, limit, returning);
    }

    @Override
    public SqlNode visitQuery(Query node) {
        With with = rewrite(node.getWith(), With.class);
        QueryBody body = rewrite(node.getBody(), QueryBody.class);
        OrderBy orderBy = rewrite(node.getOrderBy(), OrderBy.class);
        Limit limit = rewrite(node.getLimit(), Limit.class);
        return new Query(with, body, orderBy, limit);
    }

    @Override
    public SqlNode visitWith(With node) {
        return new With(node.isRecursive(), rewriteAll(node.getTables(), CommonTableExpression.class));
    }

    @Override
    public SqlNode visitCommonTableExpression(CommonTableExpression node) {
        Identifier name = rewrite(node.getName(), Identifier.class);
        List<Identifier> columns = rewriteAll(node.getColumns(), Identifier.class);
        return new CommonTableExpression(name, columns, rewrite(node.getQuery(), Query.class));
    }

    @Override
    public SqlNode visitSelect(Select node) {
        List<Expression> distinctOn = rewriteAll(node.getDistinctOn(), Expression.class);
        Top top = rewrite(node.getTop(), Top.class);
        List<SelectItem> items = rewriteAll(node.getItems(), SelectItem.class);
        Relation from = rewrite(node.getFrom(), Relation.class);
        Expression where = rewrite(node.getWhere(), Expression.class);
        GroupBy groupBy = rewrite(node.getGroupBy(), GroupBy.class);
        Expression having = rewrite(node.getHaving(), Expression.class);
        return new Select(node.isDistinct(), distinctOn, top, items, from, where, groupBy, having,
                node.isForUpdate());
    }

    @Override
    public SqlNode visitSetOperation(SetOperation node) {
        QueryBody left = rewrite(node.getLeft(), QueryBody.class);
        QueryBody right = rewrite(node.getRight(), QueryBody.class);
        return new SetOperation(node.getOperator(), left, right);
    }

    @Override
    public SqlNode visitSelectItem(SelectItem node) {
        Expression expression = rewrite(node.getExpression(), Expression.class);
        return new SelectItem(expression, rewrite(node.getAlias(), Alias.class));
    }

    @Override
    public SqlNode visitAlias(Alias node) {
        return new Alias(rewrite(node.getName(), Identifier.class), node.isExplicitAs());
    }

    @Override
    public SqlNode visitTop(Top node) {
        return new Top(rewrite(node.getCount(), Expression.class), node.isPercent(), node.isWithTies());
    }

    @Override
    public SqlNode visitGroupBy(GroupBy node) {
        return new GroupBy(rewriteAll(node.getItems(), Expression.class));
    }

    @Override
    public SqlNode visitOrderBy(OrderBy node) {
        return new OrderBy(rewriteAll(node.getItems(), SortItem.class));
    }

    @Override
    public SqlNode visitSortItem(SortItem node) {
        return new SortItem(rewrite(node.getExpression(), Expression.class), node.getOrdering(), node.getNullOrdering());
    }

    @Override
    public SqlNode visitLimit(Limit node) {
        Expression rowCount;
        Expression offset;
        if (node.isOffsetFirst()) {
            offset = rewrite(node.getOffset(), Expression.class);
            rowCount = rewrite(node.getRowCount(), Expression.class);
        } else {
            rowCount = rewrite(node.getRowCount(), Expression.class);
            offset = rewrite(node.getOffset(), Expression.class);
        }
        return new Limit(rowCount, offset, node.getStyle());
    }

    @Override
    public SqlNode visitAssignment(Assignment node) {
        QualifiedName target = rewrite(node.getTarget(), QualifiedName.class);
        return new Assignment(target, rewrite(node.getValue(), Expression.class));
    }

    @Override
    public SqlNode visitTable(Table node) {
        QualifiedName name = rewrite(node.getName(), QualifiedName.class);
        return new Table(name, rewrite(node.getAlias(), Alias.class));
    }

    @Override
    public SqlNode visitDerivedTable(DerivedTable node) {
        Query query = rewrite(node.getQuery(), Query.class);
        return new DerivedTable(query, rewrite(node.getAlias(), Alias.class));
    }

    @Override
    public SqlNode visitJoin(Join node) {
        Relation left = rewrite(node.getLeft(), Relation.class);
        Relation right = rewrite(node.getRight(), Relation.class);
        Expression condition = rewrite(node.getCondition(), Expression.class);
        List<Identifier> using = rewriteAll(node.getUsing(), Identifier.class);
        return new Join(node.getType(), node.isQualifierSpelled(), left, right, condition, using);
    }

    @Override
    public SqlNode visitIdentifier(Identifier node) {
        return node;
    }

    @Override
    public SqlNode visitQualifiedName(QualifiedName node) {
        return new QualifiedName(rewriteAll(node.getParts(), Identifier.class));
    }

    @Override
    public SqlNode visitColumnReference(ColumnReference node) {
        return new ColumnReference(rewrite(node.getName(), QualifiedName.class));
    }

    @Override
    public SqlNode visitAllColumns(AllColumns node) {
        return new AllColumns(rewrite(node.getQualifier(), QualifiedName.class));
    }

    @Override
    public SqlNode visitLiteral(Literal node) {
        return node;
    }

    @Override
    public SqlNode visitPlaceholder(Placeholder node) {
        return node;
    }

    @Override
    public SqlNode visitBindParameter(BindParameter node) {
        return node;
    }

    @Override
    public SqlNode visitBinaryOperation(BinaryOperation node) {
        Expression left = rewrite(node.getLeft(), Expression.class);
        Expression right = rewrite(node.getRight(), Expression.class);
        return new BinaryOperation(node.getOperator(), left, right);
    }

    @Override
    public SqlNode visitUnaryOperation(UnaryOperation node) {
        return new UnaryOperation(node.getOperator(), rewrite(node.getOperand(), Expression.class));
    }

    @Override
    public SqlNode visitIsPredicate(IsPredicate node) {
        return new IsPredicate(rewrite(node.getOperand(), Expression.class), node.isNegated(), node.getTarget());
    }

    @Override
    public SqlNode visitInListPredicate(InListPredicate node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        return new InListPredicate(operand, node.isNegated(), rewrite(node.getValues(), ExpressionList.class));
    }

    @Override
    public SqlNode visitInSubqueryPredicate(InSubqueryPredicate node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        return new InSubqueryPredicate(operand, node.isNegated(), rewrite(node.getSubquery(), Query.class));
    }

    @Override
    public SqlNode visitExistsPredicate(ExistsPredicate node) {
        return new ExistsPredicate(node.isNegated(), rewrite(node.getSubquery(), Query.class));
    }

    @Override
    public SqlNode visitBetweenPredicate(BetweenPredicate node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        Expression low = rewrite(node.getLow(), Expression.class);
        Expression high = rewrite(node.getHigh(), Expression.class);
        return new BetweenPredicate(operand, node.isNegated(), low, high);
    }

    @Override
    public SqlNode visitSubqueryExpression(SubqueryExpression node) {
        return new SubqueryExpression(rewrite(node.getQuery(), Query.class));
    }

    @Override
    public SqlNode visitQuantifiedSubquery(QuantifiedSubquery node) {
        return new QuantifiedSubquery(node.getQuantifier(), rewrite(node.getQuery(), Query.class));
    }

    @Override
    public SqlNode visitCaseExpression(CaseExpression node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        List<WhenClause> whenClauses = rewriteAll(node.getWhenClauses(), WhenClause.class);
        Expression elseResult = rewrite(node.getElseResult(), Expression.class);
        return new CaseExpression(operand, whenClauses, elseResult);
    }

    @Override
    public SqlNode visitWhenClause(WhenClause node) {
        Expression condition = rewrite(node.getCondition(), Expression.class);
        return new WhenClause(condition, rewrite(node.getResult(), Expression.class));
    }

    @Override
    public SqlNode visitFunctionCall(FunctionCall node) {
        QualifiedName name = rewrite(node.getName(), QualifiedName.class);
        List<Expression> arguments = rewriteAll(node.getArguments(), Expression.class);
        Expression filter = rewrite(node.getFilter(), Expression.class);
        WindowSpecification window = rewrite(node.getWindow(), WindowSpecification.class);
        return new FunctionCall(name, node.isDistinct(), arguments, filter, window);
    }

    @Override
    public SqlNode visitWindowSpecification(WindowSpecification node) {
        List<Expression> partitionBy = rewriteAll(node.getPartitionBy(), Expression.class);
        return new WindowSpecification(partitionBy, rewrite(node.getOrderBy(), OrderBy.class));
    }

    @Override
    public SqlNode visitCastExpression(CastExpression node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        return new CastExpression(operand, rewrite(node.getType(), DataType.class));
    }

    @Override
    public SqlNode visitDataType(DataType node) {
        return node;
    }

    @Override
    public SqlNode visitExtractExpression(ExtractExpression node) {
        return new ExtractExpression(node.getField(), rewrite(node.getSource(), Expression.class));
    }

    @Override
    public SqlNode visitArrayConstructor(ArrayConstructor node) {
        return new ArrayConstructor(rewriteAll(node.getElements(), Expression.class));
    }

    @Override
    public SqlNode visitExpressionList(ExpressionList node) {
        return new ExpressionList(rewriteAll(node.getItems(), Expression.class));
    }

    @Override
    public SqlNode visitKeywordExpression(KeywordExpression node) {
        return node;
    }

    @Override
    public SqlNode visitParenthesized(Parenthesized node) {
        return new Parenthesized(rewrite(node.getExpression(), Expression.class));
    }
}
