package com.whosly.sqlfp.tree;

import java.util.List;

/**
 * Simple ({@code CASE x WHEN ...}) or searched ({@code CASE WHEN ...}) case expression.
 */
public class CaseExpression extends Expression {

    private final Expression operand;
    private final List<WhenClause> whenClauses;
    private final Expression elseResult;

    public CaseExpression(Expression operand, List<WhenClause> whenClauses, Expression elseResult) {
        this.operand = operand;
        this.whenClauses = List.copyOf(whenClauses);
        this.elseResult = elseResult;
    }

    /**
     * @return the operand of a simple case, {@code null} for a searched case
     */
    public Expression getOperand() {
        return operand;
    }

    public List<WhenClause> getWhenClauses() {
        return whenClauses;
    }

    public Expression getElseResult() {
        return elseResult;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitCaseExpression(this);
    }
}
