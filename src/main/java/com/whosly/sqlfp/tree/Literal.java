package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A constant value. {@code text} is its canonical source rendering, for
 * example {@code 42}, {@code 'bob'} or {@code DATE '2024-01-01'}.
 */
public class Literal extends Expression {

    private final LiteralKind literalKind;
    private final String text;

    public Literal(LiteralKind literalKind, String text) {
        this.literalKind = Objects.requireNonNull(literalKind, "literalKind");
        this.text = Objects.requireNonNull(text, "text");
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
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
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return literalKind + ":" + text;
    }
}
