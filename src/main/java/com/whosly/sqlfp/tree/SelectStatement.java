package com.whosly.sqlfp.tree;

import java.util.Objects;

public class SelectStatement extends Statement {

    private final Query query;

    public SelectStatement(Query query) {
        this.query = Objects.requireNonNull(query, "query");
    }

    public Query getQuery() {
        return query;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSelectStatement(this);
    }
}
