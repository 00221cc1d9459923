package com.whosly.sqlfp.tree;

/**
 * A node that can appear in value position.
 */
public abstract class Expression extends SqlNode {

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION;
    }
}
