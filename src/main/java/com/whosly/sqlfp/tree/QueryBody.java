package com.whosly.sqlfp.tree;

/**
 * The body of a query: a plain SELECT, a set operation or a nested query.
 */
public abstract class QueryBody extends SqlNode {

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }
}
