package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A bind marker already present in the input ({@code ?}, {@code $1},
 * {@code :name}, {@code @var}). Not a literal.
 */
public class BindParameter extends Expression {

    private final String text;

    public BindParameter(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitBindParameter(this);
    }
}
