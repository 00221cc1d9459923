package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.tree.BetweenPredicate;
import com.whosly.sqlfp.tree.BinaryOperation;
import com.whosly.sqlfp.tree.BinaryOperator;
import com.whosly.sqlfp.tree.Expression;
import com.whosly.sqlfp.tree.InListPredicate;
import com.whosly.sqlfp.tree.InSubqueryPredicate;
import com.whosly.sqlfp.tree.IsPredicate;
import com.whosly.sqlfp.tree.UnaryOperation;

/**
 * Binding strength of an expression as a whole. Atoms bind tightest.
 */
final class Precedence {

    static final int PREDICATE = BinaryOperator.COMPARISON_PRECEDENCE;
    static final int ATOM = 100;

    private Precedence() {
    }

    static int of(Expression expression) {
        if (expression instanceof BinaryOperation) {
            return ((BinaryOperation) expression).getOperator().getPrecedence();
        }
        if (expression instanceof UnaryOperation) {
            return ((UnaryOperation) expression).getOperator().getPrecedence();
        }
        if (expression instanceof IsPredicate
                || expression instanceof InListPredicate
                || expression instanceof InSubqueryPredicate
                || expression instanceof BetweenPredicate) {
            return PREDICATE;
        }
        return ATOM;
    }
}
