package com.whosly.sqlfp.tree;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Binary operators with their canonical spelling and binding strength.
 * A higher precedence binds tighter.
 */
public enum BinaryOperator {
    ASSIGN(":=", 5),
    OR("OR", 10),
    XOR("XOR", 20),
    AND("AND", 30),

    EQUAL("=", 40),
    NOT_EQUAL("<>", 40),
    BANG_EQUAL("!=", 40),
    LESS_THAN("<", 40),
    LESS_THAN_OR_EQUAL("<=", 40),
    GREATER_THAN(">", 40),
    GREATER_THAN_OR_EQUAL(">=", 40),
    NULL_SAFE_EQUAL("<=>", 40),
    NOT_LESS_THAN("!<", 40),
    NOT_GREATER_THAN("!>", 40),
    IS_DISTINCT_FROM("IS DISTINCT FROM", 40),
    IS_NOT_DISTINCT_FROM("IS NOT DISTINCT FROM", 40),
    LIKE("LIKE", 40),
    NOT_LIKE("NOT LIKE", 40),
    ILIKE("ILIKE", 40),
    NOT_ILIKE("NOT ILIKE", 40),
    RLIKE("RLIKE", 40),
    NOT_RLIKE("NOT RLIKE", 40),
    REGEXP("REGEXP", 40),
    NOT_REGEXP("NOT REGEXP", 40),
    SIMILAR_TO("SIMILAR TO", 40),
    NOT_SIMILAR_TO("NOT SIMILAR TO", 40),
    SOUNDS_LIKE("SOUNDS LIKE", 40),
    ESCAPE("ESCAPE", 40),
    REGEX_MATCH("~", 40),
    REGEX_IMATCH("~*", 40),
    REGEX_NOT_MATCH("!~", 40),
    REGEX_NOT_IMATCH("!~*", 40),

    BITWISE_OR("|", 50),
    BITWISE_XOR("^", 55),
    BITWISE_AND("&", 60),
    SHIFT_LEFT("<<", 65),
    SHIFT_RIGHT(">>", 65),

    PLUS("+", 70),
    MINUS("-", 70),
    CONCAT("||", 70),

    MULTIPLY("*", 80),
    DIVIDE("/", 80),
    MODULO("%", 80),
    DIV("DIV", 80),
    MOD("MOD", 80),

    JSON_GET("->", 90),
    JSON_GET_TEXT("->>", 90),
    JSON_PATH("#>", 90),
    JSON_PATH_TEXT("#>>", 90),
    CONTAINS("@>", 90),
    CONTAINED_BY("<@", 90),
    OVERLAPS("&&", 90),
    TEXT_MATCH("@@", 90),
    COLLATE("COLLATE", 90);

    public static final int COMPARISON_PRECEDENCE = 40;

    private static final Map<String, BinaryOperator> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    /**
     * Look up an operator by its spelling, ignoring keyword case and
     * repeated whitespace.
     *
     * @param symbol the operator as written
     * @return the operator, or {@code null} when unknown
     */
    public static BinaryOperator fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        return BY_SYMBOL.get(symbol.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT));
    }
}
