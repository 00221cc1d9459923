package com.whosly.sqlfp.tree;

import java.util.Objects;

public class Table extends Relation {

    private final QualifiedName name;
    private final Alias alias;

    public Table(QualifiedName name, Alias alias) {
        this.name = Objects.requireNonNull(name, "name");
        this.alias = alias;
    }

    public QualifiedName getName() {
        return name;
    }

    public Alias getAlias() {
        return alias;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
