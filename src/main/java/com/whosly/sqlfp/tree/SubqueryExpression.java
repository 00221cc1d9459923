package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A scalar subquery used as a value.
 */
public class SubqueryExpression extends Expression {

    private final Query query;

    public SubqueryExpression(Query query) {
        this.query = Objects.requireNonNull(query, "query");
    }

    public Query getQuery() {
        return query;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSubqueryExpression(this);
    }
}
