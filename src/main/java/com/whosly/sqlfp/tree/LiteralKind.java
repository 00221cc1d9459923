package com.whosly.sqlfp.tree;

/**
 * Kinds of constant values that are replaced by placeholders.
 */
public enum LiteralKind {
    NUMERIC,
    STRING,
    BOOLEAN,
    NULL,
    TEMPORAL
}
