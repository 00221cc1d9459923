package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

/**
 * Two relations joined by ON, USING or nothing (cross, natural and comma joins).
 *
 * {@code qualifierSpelled} records whether the optional INNER or OUTER word
 * was written in the source.
 */
public class Join extends Relation {

    public enum Type {
        INNER, LEFT, RIGHT, FULL, CROSS, NATURAL, COMMA
    }

    private final Type type;
    private final boolean qualifierSpelled;
    private final Relation left;
    private final Relation right;
    private final Expression condition;
    private final List<Identifier> using;

    public Join(Type type, boolean qualifierSpelled, Relation left, Relation right,
                Expression condition, List<Identifier> using) {
        this.type = Objects.requireNonNull(type, "type");
        this.qualifierSpelled = qualifierSpelled;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.condition = condition;
        this.using = List.copyOf(using);
    }

    public Type getType() {
        return type;
    }

    public boolean isQualifierSpelled() {
        return qualifierSpelled;
    }

    public Relation getLeft() {
        return left;
    }

    public Relation getRight() {
        return right;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Identifier> getUsing() {
        return using;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitJoin(this);
    }
}
