package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * {@code ANY (...)}, {@code SOME (...)} or {@code ALL (...)} on the right of a comparison.
 */
public class QuantifiedSubquery extends Expression {

    public enum Quantifier {
        ANY, SOME, ALL
    }

    private final Quantifier quantifier;
    private final Query query;

    public QuantifiedSubquery(Quantifier quantifier, Query query) {
        this.quantifier = Objects.requireNonNull(quantifier, "quantifier");
        this.query = Objects.requireNonNull(query, "query");
    }

    public Quantifier getQuantifier() {
        return quantifier;
    }

    public Query getQuery() {
        return query;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitQuantifiedSubquery(this);
    }
}
