package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A subquery in FROM position.
 */
public class DerivedTable extends Relation {

    private final Query query;
    private final Alias alias;

    public DerivedTable(Query query, Alias alias) {
        this.query = Objects.requireNonNull(query, "query");
        this.alias = alias;
    }

    public Query getQuery() {
        return query;
    }

    public Alias getAlias() {
        return alias;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitDerivedTable(this);
    }
}
