package com.whosly.sqlfp.tree;

import java.util.Objects;

public class CastExpression extends Expression {

    private final Expression operand;
    private final DataType type;

    public CastExpression(Expression operand, DataType type) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.type = Objects.requireNonNull(type, "type");
    }

    public Expression getOperand() {
        return operand;
    }

    public DataType getType() {
        return type;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitCastExpression(this);
    }
}
