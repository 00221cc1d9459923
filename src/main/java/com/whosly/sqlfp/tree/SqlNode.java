package com.whosly.sqlfp.tree;

/**
 * Base class of the read-only SQL tree.
 *
 * Nodes are immutable. Transformations produce rewritten copies through
 * {@link TreeRewriter} and never modify the node they start from.
 */
public abstract class SqlNode {

    /**
     * @return the coarse kind of this node
     */
    public abstract NodeKind getKind();

    /**
     * Dispatch to the visitor method matching this node type.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor result
     */
    public abstract <R> R accept(SqlNodeVisitor<R> visitor);
}
