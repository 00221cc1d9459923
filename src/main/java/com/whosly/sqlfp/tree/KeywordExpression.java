package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * A value spelled as a keyword: {@code DEFAULT}, {@code CURRENT_TIMESTAMP}, {@code SYSDATE}.
 */
public class KeywordExpression extends Expression {

    private final String keyword;

    public KeywordExpression(String keyword) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
    }

    public String getKeyword() {
        return keyword;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitKeywordExpression(this);
    }
}
