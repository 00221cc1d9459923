package com.whosly.sqlfp.tree;

/**
 * Visitor over the SQL tree, one method per node type.
 *
 * @param <R> the result type
 */
public interface SqlNodeVisitor<R> {

    // statements
    R visitSelectStatement(SelectStatement node);
    R visitInsertStatement(InsertStatement node);
    R visitUpdateStatement(UpdateStatement node);
    R visitDeleteStatement(DeleteStatement node);

    // query structure
    R visitQuery(Query node);
    R visitWith(With node);
    R visitCommonTableExpression(CommonTableExpression node);
    R visitSelect(Select node);
    R visitSetOperation(SetOperation node);
    R visitSelectItem(SelectItem node);
    R visitAlias(Alias node);
    R visitTop(Top node);
    R visitGroupBy(GroupBy node);
    R visitOrderBy(OrderBy node);
    R visitSortItem(SortItem node);
    R visitLimit(Limit node);
    R visitAssignment(Assignment node);
    R visitOnConflict(OnConflict node);

    // relations
    R visitTable(Table node);
    R visitDerivedTable(DerivedTable node);
    R visitJoin(Join node);

    // names and values
    R visitIdentifier(Identifier node);
    R visitQualifiedName(QualifiedName node);
    R visitColumnReference(ColumnReference node);
    R visitAllColumns(AllColumns node);
    R visitLiteral(Literal node);
    R visitPlaceholder(Placeholder node);
    R visitBindParameter(BindParameter node);

    // operators and predicates
    R visitBinaryOperation(BinaryOperation node);
    R visitUnaryOperation(UnaryOperation node);
    R visitIsPredicate(IsPredicate node);
    R visitInListPredicate(InListPredicate node);
    R visitInSubqueryPredicate(InSubqueryPredicate node);
    R visitExistsPredicate(ExistsPredicate node);
    R visitBetweenPredicate(BetweenPredicate node);
    R visitSubqueryExpression(SubqueryExpression node);
    R visitQuantifiedSubquery(QuantifiedSubquery node);

    // other expressions
    R visitCaseExpression(CaseExpression node);
    R visitWhenClause(WhenClause node);
    R visitFunctionCall(FunctionCall node);
    R visitWindowSpecification(WindowSpecification node);
    R visitCastExpression(CastExpression node);
    R visitDataType(DataType node);
    R visitExtractExpression(ExtractExpression node);
    R visitArrayConstructor(ArrayConstructor node);
    R visitExpressionList(ExpressionList node);
    R visitKeywordExpression(KeywordExpression node);
    R visitParenthesized(Parenthesized node);
}
