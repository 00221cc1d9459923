package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * {@code column = value} in SET, ON DUPLICATE KEY UPDATE and ON CONFLICT DO UPDATE lists.
 */
public class Assignment extends SqlNode {

    private final QualifiedName target;
    private final Expression value;

    public Assignment(QualifiedName target, Expression value) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public QualifiedName getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
