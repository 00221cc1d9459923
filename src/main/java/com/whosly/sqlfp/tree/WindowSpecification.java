package com.whosly.sqlfp.tree;

import java.util.List;

/**
 * {@code OVER (PARTITION BY ... ORDER BY ...)}.
 */
public class WindowSpecification extends SqlNode {

    private final List<Expression> partitionBy;
    private final OrderBy orderBy;

    public WindowSpecification(List<Expression> partitionBy, OrderBy orderBy) {
        this.partitionBy = List.copyOf(partitionBy);
        this.orderBy = orderBy;
    }

    public List<Expression> getPartitionBy() {
        return partitionBy;
    }

    public OrderBy getOrderBy() {
        return orderBy;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitWindowSpecification(this);
    }
}
