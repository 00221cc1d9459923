package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

public class DeleteStatement extends Statement {

    private final Relation target;
    private final Expression where;
    private final OrderBy orderBy;
    private final Limit limit;
    private final List<Expression> returning;

    public DeleteStatement(Relation target, Expression where, OrderBy orderBy, Limit limit) {
        this(target, where, orderBy, limit, List.of());
    }

    public DeleteStatement(Relation target, Expression where, OrderBy orderBy, Limit limit,
                           List<Expression> returning) {
        this.target = Objects.requireNonNull(target, "target");
        this.where = where;
        this.orderBy = orderBy;
        this.limit = limit;
        this.returning = List.copyOf(returning);
    }

    public Relation getTarget() {
        return target;
    }

    public Expression getWhere() {
        return where;
    }

    public OrderBy getOrderBy() {
        return orderBy;
    }

    public Limit getLimit() {
        return limit;
    }

    public List<Expression> getReturning() {
        return returning;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitDeleteStatement(this);
    }
}
