package com.whosly.sqlfp.tree;

import java.util.List;
import java.util.Objects;

public class FunctionCall extends Expression {

    private final QualifiedName name;
    private final boolean distinct;
    private final List<Expression> arguments;
    private final Expression filter;
    private final WindowSpecification window;

    public FunctionCall(QualifiedName name, boolean distinct, List<Expression> arguments, WindowSpecification window) {
        this(name, distinct, arguments, null, window);
    }

    public FunctionCall(QualifiedName name, boolean distinct, List<Expression> arguments, Expression filter,
                        WindowSpecification window) {
        this.name = Objects.requireNonNull(name, "name");
        this.distinct = distinct;
        this.arguments = List.copyOf(arguments);
        this.filter = filter;
        this.window = window;
    }

    public QualifiedName getName() {
        return name;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    /**
     * @return the condition of an aggregate {@code FILTER (WHERE ...)}, or {@code null}
     */
    public Expression getFilter() {
        return filter;
    }

    /**
     * @return the OVER clause, or {@code null} for a plain call
     */
    public WindowSpecification getWindow() {
        return window;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
