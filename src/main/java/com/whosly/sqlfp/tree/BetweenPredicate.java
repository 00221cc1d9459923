package com.whosly.sqlfp.tree;

import java.util.Objects;

public class BetweenPredicate extends Expression {

    private final Expression operand;
    private final boolean negated;
    private final Expression low;
    private final Expression high;

    public BetweenPredicate(Expression operand, boolean negated, Expression low, Expression high) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.negated = negated;
        this.low = Objects.requireNonNull(low, "low");
        this.high = Objects.requireNonNull(high, "high");
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    public Expression getLow() {
        return low;
    }

    public Expression getHigh() {
        return high;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitBetweenPredicate(this);
    }
}
