package com.whosly.sqlfp.tree;

import java.util.Objects;

public class SortItem extends SqlNode {

    public enum Ordering {
        UNSPECIFIED, ASC, DESC
    }

    public enum NullOrdering {
        UNSPECIFIED, FIRST, LAST
    }

    private final Expression expression;
    private final Ordering ordering;
    private final NullOrdering nullOrdering;

    public SortItem(Expression expression, Ordering ordering, NullOrdering nullOrdering) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.ordering = Objects.requireNonNull(ordering, "ordering");
        this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering");
    }

    public Expression getExpression() {
        return expression;
    }

    public Ordering getOrdering() {
        return ordering;
    }

    public NullOrdering getNullOrdering() {
        return nullOrdering;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSortItem(this);
    }
}
