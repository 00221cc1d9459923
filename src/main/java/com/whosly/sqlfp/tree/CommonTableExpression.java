package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

/**
 * {@code name [(columns)] AS (query)} inside a WITH clause.
 */
public class CommonTableExpression extends SqlNode {

    private final Identifier name;
    private final List<Identifier> columns;
    private final Query query;

    public CommonTableExpression(Identifier name, List<Identifier> columns, Query query) {
        this.name = Objects.requireNonNull(name, "name");
        this.columns = List.copyOf(columns);
        this.query = Objects.requireNonNull(query, "query");
    }

    public Identifier getName() {
        return name;
    }

    public List<Identifier> getColumns() {
        return columns;
    }

    public Query getQuery() {
        return query;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitCommonTableExpression(this);
    }
}
