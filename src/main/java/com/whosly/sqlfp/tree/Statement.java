package com.whosly.sqlfp.tree;

/**
 * Root of a parsed SQL statement.
 */
public abstract class Statement extends SqlNode {

    @Override
    public NodeKind getKind() {
        return NodeKind.STATEMENT;
    }
}
