package com.whosly.sqlfp.tree;

/**
 * Prefix operators. {@code keyword} operators are followed by a space when rendered.
 */
public enum UnaryOperator {
    NOT("NOT", 35, true),
    MINUS("-", 85, false),
    PLUS("+", 85, false),
    BITWISE_NOT("~", 85, false);

    private final String symbol;
    private final int precedence;
    private final boolean keyword;

    UnaryOperator(String symbol, int precedence, boolean keyword) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.keyword = keyword;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isKeyword() {
        return keyword;
    }
}
