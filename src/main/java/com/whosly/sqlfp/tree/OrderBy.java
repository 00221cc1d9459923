package com.whosly.sqlfp.tree;

import java.util.List;

public class OrderBy extends SqlNode {

    private final List<SortItem> items;

    public OrderBy(List<SortItem> items) {
        this.items = List.copyOf(items);
    }

    public List<SortItem> getItems() {
        return items;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitOrderBy(this);
    }
}
