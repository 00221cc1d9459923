package com.whosly.sqlfp.tree;

/**
 * Row limiting. Either bound may be absent, not both.
 *
 * The style decides the rendered shape and therefore the order of the two
 * bounds: {@code LIMIT rowCount OFFSET offset} or
 * {@code OFFSET offset ROWS FETCH NEXT rowCount ROWS ONLY}.
 */
public class Limit extends SqlNode {

    public enum Style {
        LIMIT_OFFSET,
        OFFSET_FETCH
    }

    private final Expression rowCount;
    private final Expression offset;
    private final Style style;

    public Limit(Expression rowCount, Expression offset, Style style) {
        if (rowCount == null && offset == null) {
            throw new IllegalArgumentException("Limit needs a row count or an offset");
        }
        this.rowCount = rowCount;
        this.offset = offset;
        this.style = style;
    }

    public Expression getRowCount() {
        return rowCount;
    }

    public Expression getOffset() {
        return offset;
    }

    public Style getStyle() {
        return style;
    }

    public boolean isOffsetFirst() {
        return style == Style.OFFSET_FETCH;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitLimit(this);
    }
}
