package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A complete query expression: optional WITH, a body and the ORDER BY and
 * row limit applying to the whole body.
 *
 * When a query is itself used as a body (an operand of a set operation or
 * the body of another query) it is rendered in parentheses.
 */
public class Query extends QueryBody {

    private final With with;
    private final QueryBody body;
    private final OrderBy orderBy;
    private final Limit limit;

    public Query(With with, QueryBody body, OrderBy orderBy, Limit limit) {
        this.with = with;
        this.body = Objects.requireNonNull(body, "body");
        this.orderBy = orderBy;
        this.limit = limit;
    }

    public static Query simple(QueryBody body) {
        return new Query(null, body, null, null);
    }

    public With getWith() {
        return with;
    }

    public QueryBody getBody() {
        return body;
    }

    public OrderBy getOrderBy() {
        return orderBy;
    }

    public Limit getLimit() {
        return limit;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }
}
