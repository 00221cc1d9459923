package com.whosly.sqlfp.tree;

import java.util.List;

public class With extends SqlNode {

    private final boolean recursive;
    private final List<CommonTableExpression> tables;

    public With(boolean recursive, List<CommonTableExpression> tables) {
        this.recursive = recursive;
        this.tables = List.copyOf(tables);
    }

    public boolean isRecursive() {
        return recursive;
    }

    public List<CommonTableExpression> getTables() {
        return tables;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitWith(this);
    }
}
