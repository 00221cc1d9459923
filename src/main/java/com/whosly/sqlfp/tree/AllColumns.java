package com.whosly.sqlfp.tree;

/**
 * {@code *} or {@code t.*}.
 */
public class AllColumns extends Expression {

    private final QualifiedName qualifier;

    public AllColumns(QualifiedName qualifier) {
        this.qualifier = qualifier;
    }

    /**
     * @return the relation qualifier, or {@code null} for a bare {@code *}
     */
    public QualifiedName getQualifier() {
        return qualifier;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitAllColumns(this);
    }
}
