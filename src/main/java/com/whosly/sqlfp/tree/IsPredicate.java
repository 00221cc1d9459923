package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * {@code x IS [NOT] NULL|TRUE|FALSE|UNKNOWN}. The right-hand keyword is part
 * of the predicate shape and never a literal.
 */
public class IsPredicate extends Expression {

    public enum Target {
        NULL, TRUE, FALSE, UNKNOWN
    }

    private final Expression operand;
    private final boolean negated;
    private final Target target;

    public IsPredicate(Expression operand, boolean negated, Target target) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.negated = negated;
        this.target = Objects.requireNonNull(target, "target");
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitIsPredicate(this);
    }
}
