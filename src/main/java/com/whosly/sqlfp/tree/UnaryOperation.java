package com.whosly.sqlfp.tree;

import java.util.Objects;

public class UnaryOperation extends Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryOperation(UnaryOperator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitUnaryOperation(this);
    }
}
