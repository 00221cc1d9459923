package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.LiteralKind;
import com.whosly.sqlfp.tree.SqlNode;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which tree nodes are literals that get replaced by a placeholder.
 *
 * Only {@link Literal} nodes qualify. Identifiers, bind markers already in
 * the input, keywords, type arguments and the right side of
 * {@code IS [NOT] NULL} are separate node types and never match.
 */
public final class LiteralClassifier {

    private static final Set<LiteralKind> PARAMETERIZED = EnumSet.allOf(LiteralKind.class);

    private LiteralClassifier() {
    }

    /**
     * @param node any tree node
     * @return the literal kind when {@code node} is a replaceable literal
     */
    public static Optional<LiteralKind> classify(SqlNode node) {
        if (node instanceof Literal) {
            LiteralKind kind = ((Literal) node).getLiteralKind();
            if (PARAMETERIZED.contains(kind)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isLiteral(SqlNode node) {
        return classify(node).isPresent();
    }
}
