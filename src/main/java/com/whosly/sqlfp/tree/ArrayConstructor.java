package com.whosly.sqlfp.tree;

import java.util.List;

/**
 * {@code ARRAY[a, b]}.
 */
public class ArrayConstructor extends Expression {

    private final List<Expression> elements;

    public ArrayConstructor(List<Expression> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitArrayConstructor(this);
    }
}
