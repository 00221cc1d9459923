package com.whosly.sqlfp.tree;

import java.util.Objects;

public class ExistsPredicate extends Expression {

    private final boolean negated;
    private final Query subquery;

    public ExistsPredicate(boolean negated, Query subquery) {
        this.negated = negated;
        this.subquery = Objects.requireNonNull(subquery, "subquery");
    }

    public boolean isNegated() {
        return negated;
    }

    public Query getSubquery() {
        return subquery;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitExistsPredicate(this);
    }
}
