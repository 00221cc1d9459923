package com.whosly.sqlfp.tree;

import java.util.Objects;

public class InListPredicate extends Expression {

    private final Expression operand;
    private final boolean negated;
    private final ExpressionList values;

    public InListPredicate(Expression operand, boolean negated, ExpressionList values) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.negated = negated;
        this.values = Objects.requireNonNull(values, "values");
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    public ExpressionList getValues() {
        return values;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitInListPredicate(this);
    }
}
