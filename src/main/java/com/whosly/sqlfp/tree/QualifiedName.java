package com.whosly.sqlfp.tree;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A dotted name such as {@code schema.table} or {@code t.col}.
 */
public class QualifiedName extends SqlNode {

    private final List<Identifier> parts;

    public QualifiedName(List<Identifier> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Qualified name needs at least one part");
        }
        this.parts = List.copyOf(parts);
    }

    public static QualifiedName of(Identifier... parts) {
        return new QualifiedName(List.of(parts));
    }

    public static QualifiedName of(String... unquotedParts) {
        return new QualifiedName(Arrays.stream(unquotedParts)
                .map(Identifier::unquoted)
                .collect(Collectors.toList()));
    }

    public List<Identifier> getParts() {
        return parts;
    }

    public Identifier getLast() {
        return parts.get(parts.size() - 1);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitQualifiedName(this);
    }

    @Override
    public String toString() {
        return parts.stream().map(Identifier::toString).collect(Collectors.joining("."));
    }
}
