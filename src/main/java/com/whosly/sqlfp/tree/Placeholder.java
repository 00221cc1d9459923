package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * Substitution site left behind by a removed literal. Rendered verbatim.
 */
public class Placeholder extends Expression {

    private final String text;

    public Placeholder(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitPlaceholder(this);
    }
}
