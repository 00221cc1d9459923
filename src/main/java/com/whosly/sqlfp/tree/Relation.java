package com.whosly.sqlfp.tree;

/**
 * Something a FROM clause can read from: a table, a derived table or a join.
 */
public abstract class Relation extends SqlNode {

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }
}
