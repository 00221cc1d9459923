package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * SQL Server {@code TOP n [PERCENT] [WITH TIES]}.
 */
public class Top extends SqlNode {

    private final Expression count;
    private final boolean percent;
    private final boolean withTies;

    public Top(Expression count, boolean percent, boolean withTies) {
        this.count = Objects.requireNonNull(count, "count");
        this.percent = percent;
        this.withTies = withTies;
    }

    public Expression getCount() {
        return count;
    }

    public boolean isPercent() {
        return percent;
    }

    public boolean isWithTies() {
        return withTies;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitTop(this);
    }
}
