package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A single name part. {@code value} holds the name without delimiters.
 */
public class Identifier extends SqlNode {

    private final String value;
    private final QuoteStyle quoteStyle;

    public Identifier(String value, QuoteStyle quoteStyle) {
        this.value = Objects.requireNonNull(value, "value");
        this.quoteStyle = Objects.requireNonNull(quoteStyle, "quoteStyle");
    }

    public static Identifier unquoted(String value) {
        return new Identifier(value, QuoteStyle.NONE);
    }

    /**
     * Split a raw name as written in SQL (for example {@code `order`} or
     * {@code "User"}) into its value and quote style.
     *
     * @param raw the raw name
     * @return the identifier
     */
    public static Identifier parse(String raw) {
        if (raw.length() >= 2) {
            QuoteStyle style = QuoteStyle.forOpening(raw.charAt(0));
            if (style.isQuoted() && raw.charAt(raw.length() - 1) == style.getClose()) {
                String body = raw.substring(1, raw.length() - 1);
                String doubled = String.valueOf(style.getClose()) + style.getClose();
                return new Identifier(body.replace(doubled, String.valueOf(style.getClose())), style);
            }
        }
        return unquoted(raw);
    }

    public String getValue() {
        return value;
    }

    public QuoteStyle getQuoteStyle() {
        return quoteStyle;
    }

    public boolean isQuoted() {
        return quoteStyle.isQuoted();
    }

    public Identifier withQuoteStyle(QuoteStyle style) {
        return style == quoteStyle ? this : new Identifier(value, style);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return quoteStyle.isQuoted() ? quoteStyle.getOpen() + value + quoteStyle.getClose() : value;
    }
}
