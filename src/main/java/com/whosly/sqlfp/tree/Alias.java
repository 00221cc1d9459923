package com.whosly.sqlfp.tree;

import java.util.Objects;

/**
 * An alias with the way it was introduced: {@code x AS a} or {@code x a}.
 */
public class Alias extends SqlNode {

    private final Identifier name;
    private final boolean explicitAs;

    public Alias(Identifier name, boolean explicitAs) {
        this.name = Objects.requireNonNull(name, "name");
        this.explicitAs = explicitAs;
    }

    public Identifier getName() {
        return name;
    }

    public boolean isExplicitAs() {
        return explicitAs;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLAUSE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitAlias(this);
    }
}
