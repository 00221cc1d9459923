package com.whosly.sqlfp.tree;

import java.util.List;

public class GroupBy extends SqlNode {

    private final List<Expression> items;

    public GroupBy(List<Expression> items) {
        this.items = List.copyOf(items);
    }

    public List<Expression> getItems() {
        return items;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitGroupBy(this);
    }
}
