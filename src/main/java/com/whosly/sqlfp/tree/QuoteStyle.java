package com.whosly.sqlfp.tree;

/**
 * How an identifier was delimited in the source text.
 */
public enum QuoteStyle {
    NONE(0, 0),
    DOUBLE_QUOTE('"', '"'),
    BACKTICK('`', '`'),
    BRACKET('[', ']'),
    SINGLE_QUOTE('\'', '\'');

    private final char open;
    private final char close;

    QuoteStyle(int open, int close) {
        this.open = (char) open;
        this.close = (char) close;
    }

    public char getOpen() {
        return open;
    }

    public char getClose() {
        return close;
    }

    public boolean isQuoted() {
        return this != NONE;
    }

    /**
     * Find the style whose opening character is {@code c}.
     *
     * @param c the first character of a raw identifier
     * @return the matching style, or {@link #NONE}
     */
    public static QuoteStyle forOpening(char c) {
        for (QuoteStyle style : values()) {
            if (style.isQuoted() && style.open == c) {
                return style;
            }
        }
        return NONE;
    }
}
