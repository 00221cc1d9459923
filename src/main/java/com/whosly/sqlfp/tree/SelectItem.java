package com.whosly.sqlfp.tree;

import java.util.Objects;

public class SelectItem extends SqlNode {

    private final Expression expression;
    private final Alias alias;

    public SelectItem(Expression expression, Alias alias) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.alias = alias;
    }

    public Expression getExpression() {
        return expression;
    }

    public Alias getAlias() {
        return alias;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSelectItem(this);
    }
}
