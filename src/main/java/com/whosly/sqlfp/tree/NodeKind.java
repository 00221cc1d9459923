package com.whosly.sqlfp.tree;

/**
 * Coarse classification of tree nodes.
 */
public enum NodeKind {
    STATEMENT,
    CLAUSE,
    EXPRESSION,
    IDENTIFIER,
    LITERAL,
    LIST
}
