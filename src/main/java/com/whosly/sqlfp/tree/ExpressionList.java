package com.whosly.sqlfp.tree;

import java.util.List;

/**
 * A parenthesized, comma separated list: IN-list values, VALUES rows and row
 * constructors.
 */
public class ExpressionList extends Expression {

    private final List<Expression> items;

    public ExpressionList(List<Expression> items) {
        this.items = List.copyOf(items);
    }

    public List<Expression> getItems() {
        return items;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitExpressionList(this);
    }
}
