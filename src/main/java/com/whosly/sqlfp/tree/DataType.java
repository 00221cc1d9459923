package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A type name with its arguments, kept as text ({@code VARCHAR(255)}).
 * Type arguments are never literals.
 */
public class DataType extends SqlNode {

    private final String name;

    public DataType(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitDataType(this);
    }
}
