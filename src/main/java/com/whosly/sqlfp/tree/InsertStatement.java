package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

/**
 * INSERT or REPLACE. Exactly one source is present: VALUES rows, a query, or
 * DEFAULT VALUES. At most one of ON DUPLICATE KEY UPDATE and ON CONFLICT is set.
 */
public class InsertStatement extends Statement {

    public enum Verb {
        INSERT, REPLACE
    }

    private final Verb verb;
    private final boolean ignore;
    private final QualifiedName table;
    private final List<QualifiedName> columns;
    private final List<ExpressionList> rows;
    private final Query query;
    private final boolean defaultValues;
    private final List<Assignment> onDuplicateKeyUpdate;
    private final OnConflict onConflict;
    private final List<Expression> returning;

    public InsertStatement(Verb verb, boolean ignore, QualifiedName table, List<QualifiedName> columns,
                           List<ExpressionList> rows, Query query, boolean defaultValues,
                           List<Assignment> onDuplicateKeyUpdate) {
        this(verb, ignore, table, columns, rows, query, defaultValues, onDuplicateKeyUpdate, null, List.of());
    }

    public InsertStatement(Verb verb, boolean ignore, QualifiedName table, List<QualifiedName> columns,
                           List<ExpressionList> rows, Query query, boolean defaultValues,
                           List<Assignment> onDuplicateKeyUpdate, OnConflict onConflict,
                           List<Expression> returning) {
        this.verb = Objects.requireNonNull(verb, "verb");
        this.ignore = ignore;
        this.table = Objects.requireNonNull(table, "table");
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
        this.query = query;
        this.defaultValues = defaultValues;
        this.onDuplicateKeyUpdate = List.copyOf(onDuplicateKeyUpdate);
        this.onConflict = onConflict;
        this.returning = List.copyOf(returning);
    }

    public Verb getVerb() {
        return verb;
    }

    public boolean isIgnore() {
        return ignore;
    }

    public QualifiedName getTable() {
        return table;
    }

    public List<QualifiedName> getColumns() {
        return columns;
    }

    public List<ExpressionList> getRows() {
        return rows;
    }

    public Query getQuery() {
        return query;
    }

    public boolean isDefaultValues() {
        return defaultValues;
    }

    public List<Assignment> getOnDuplicateKeyUpdate() {
        return onDuplicateKeyUpdate;
    }

    public OnConflict getOnConflict() {
        return onConflict;
    }

    public List<Expression> getReturning() {
        return returning;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitInsertStatement(this);
    }
}
