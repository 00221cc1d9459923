package com.whosly.sqlfp.tree;

import java.util.Objects;

public class InSubqueryPredicate extends Expression {

    private final Expression operand;
    private final boolean negated;
    private final Query subquery;

    public InSubqueryPredicate(Expression operand, boolean negated, Query subquery) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.negated = negated;
        this.subquery = Objects.requireNonNull(subquery, "subquery");
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    public Query getSubquery() {
        return subquery;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitInSubqueryPredicate(this);
    }
}
