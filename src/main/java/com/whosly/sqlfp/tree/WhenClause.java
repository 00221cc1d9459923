package com.whosly.sqlfp.tree;

import java.util.Objects;

public class WhenClause extends SqlNode {

    private final Expression condition;
    private final Expression result;

    public WhenClause(Expression condition, Expression result) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getResult() {
        return result;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitWhenClause(this);
    }
}
