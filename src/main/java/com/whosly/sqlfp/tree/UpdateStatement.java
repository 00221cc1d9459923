package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

public class UpdateStatement extends Statement {

    private final Relation target;
    private final List<Assignment> assignments;
    private final Relation from;
    private final Expression where;
    private final OrderBy orderBy;
    private final Limit limit;
    private final List<Expression> returning;

    public UpdateStatement(Relation target, List<Assignment> assignments, Relation from,
                           Expression where, OrderBy orderBy, Limit limit) {
        this(target, assignments, from, where, orderBy, limit, List.of());
    }

    public UpdateStatement(Relation target, List<Assignment> assignments, Relation from,
                           Expression where, OrderBy orderBy, Limit limit, List<Expression> returning) {
        this.target = Objects.requireNonNull(target, "target");
        this.assignments = List.copyOf(assignments);
        this.from = from;
        this.where = where;
        this.orderBy = orderBy;
        this.limit = limit;
        this.returning = List.copyOf(returning);
    }

    public Relation getTarget() {
        return target;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public Relation getFrom() {
        return from;
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
        return visitor.visitUpdateStatement(this);
    }
}
