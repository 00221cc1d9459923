package com.whosly.sqlfp.tree;

import java.util.Objects;

public class BinaryOperation extends Expression {

    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(BinaryOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitBinaryOperation(this);
    }
}
