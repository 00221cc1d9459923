package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * {@code EXTRACT(field FROM source)}.
 */
public class ExtractExpression extends Expression {

    private final String field;
    private final Expression source;

    public ExtractExpression(String field, Expression source) {
        this.field = Objects.requireNonNull(field, "field");
        this.source = Objects.requireNonNull(source, "source");
    }

    public String getField() {
        return field;
    }

    public Expression getSource() {
        return source;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitExtractExpression(this);
    }
}
