package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL {@code ON CONFLICT} clause of an INSERT. The conflict target is
 * either a column list (optionally with an index predicate), a named
 * constraint, or absent.
 */
public class OnConflict extends SqlNode {

    public enum Action {
        DO_NOTHING, DO_UPDATE
    }

    private final List<Expression> target;
    private final QualifiedName constraint;
    private final Expression targetWhere;
    private final Action action;
    private final List<Assignment> assignments;
    private final Expression where;

    public OnConflict(List<Expression> target, QualifiedName constraint, Expression targetWhere,
                      Action action, List<Assignment> assignments, Expression where) {
        this.target = List.copyOf(target);
        this.constraint = constraint;
        this.targetWhere = targetWhere;
        this.action = Objects.requireNonNull(action, "action");
        this.assignments = List.copyOf(assignments);
        this.where = where;
    }

    public List<Expression> getTarget() {
        return target;
    }

    public QualifiedName getConstraint() {
        return constraint;
    }

    public Expression getTargetWhere() {
        return targetWhere;
    }

    public Action getAction() {
        return action;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    /**
     * @return the condition after {@code DO UPDATE SET ...}, or {@code null}
     */
    public Expression getWhere() {
        return where;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitOnConflict(this);
    }
}
