package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A name in expression position: a column, possibly qualified.
 */
public class ColumnReference extends Expression {

    private final QualifiedName name;

    public ColumnReference(QualifiedName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public QualifiedName getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitColumnReference(this);
    }
}
