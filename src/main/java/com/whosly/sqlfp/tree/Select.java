package com.whosly.sqlfp.tree;

import java.util.List;

/**
 * A single SELECT block. Ordering and row limits live on the enclosing {@link Query}.
 */
public class Select extends QueryBody {

    private final boolean distinct;
    private final List<Expression> distinctOn;
    private final Top top;
    private final List<SelectItem> items;
    private final Relation from;
    private final Expression where;
    private final GroupBy groupBy;
    private final Expression having;
    private final boolean forUpdate;

    public Select(boolean distinct, Top top, List<SelectItem> items, Relation from,
                  Expression where, GroupBy groupBy, Expression having, boolean forUpdate) {
        this(distinct, List.of(), top, items, from, where, groupBy, having, forUpdate);
    }

    public Select(boolean distinct, List<Expression> distinctOn, Top top, List<SelectItem> items, Relation from,
                  Expression where, GroupBy groupBy, Expression having, boolean forUpdate) {
        this.distinct = distinct || !distinctOn.isEmpty();
        this.distinctOn = List.copyOf(distinctOn);
        this.top = top;
        this.items = List.copyOf(items);
        this.from = from;
        this.where = where;
        this.groupBy = groupBy;
        this.having = having;
        this.forUpdate = forUpdate;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * @return the PostgreSQL {@code DISTINCT ON} expressions, empty for a plain DISTINCT or none
     */
    public List<Expression> getDistinctOn() {
        return distinctOn;
    }

    public Top getTop() {
        return top;
    }

    public List<SelectItem> getItems() {
        return items;
    }

    public Relation getFrom() {
        return from;
    }

    public Expression getWhere() {
        return where;
    }

    public GroupBy getGroupBy() {
        return groupBy;
    }

    public Expression getHaving() {
        return having;
    }

    public boolean isForUpdate() {
        return forUpdate;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }
}
