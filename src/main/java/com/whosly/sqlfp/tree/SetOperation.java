package com.whosly.sqlfp.tree;

import java.util.Objects;

public class SetOperation extends QueryBody {

    public enum Operator {
        UNION("UNION"),
        UNION_ALL("UNION ALL"),
        INTERSECT("INTERSECT"),
        EXCEPT("EXCEPT"),
        MINUS("MINUS");

        private final String keyword;

        Operator(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Operator operator;
    private final QueryBody left;
    private final QueryBody right;

    public SetOperation(Operator operator, QueryBody left, QueryBody right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator getOperator() {
        return operator;
    }

    public QueryBody getLeft() {
        return left;
    }

    public QueryBody getRight() {
        return right;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSetOperation(this);
    }
}
