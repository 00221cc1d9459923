package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * Explicit grouping parentheses around an expression.
 */
public class Parenthesized extends Expression {

    private final Expression expression;

    public Parenthesized(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitParenthesized(this);
    }
}
