package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.UnsupportedConstructException;
import com.whosly.sqlfp.tree.Alias;
import com.whosly.sqlfp.tree.BetweenPredicate;
import com.whosly.sqlfp.tree.BinaryOperation;
import com.whosly.sqlfp.tree.ColumnReference;
import com.whosly.sqlfp.tree.DataType;
import com.whosly.sqlfp.tree.DerivedTable;
import com.whosly.sqlfp.tree.Expression;
import com.whosly.sqlfp.tree.ExpressionList;
import com.whosly.sqlfp.tree.ExtractExpression;
import com.whosly.sqlfp.tree.FunctionCall;
import com.whosly.sqlfp.tree.Identifier;
import com.whosly.sqlfp.tree.InListPredicate;
import com.whosly.sqlfp.tree.InSubqueryPredicate;
import com.whosly.sqlfp.tree.IsPredicate;
import com.whosly.sqlfp.tree.Join;
import com.whosly.sqlfp.tree.KeywordExpression;
import com.whosly.sqlfp.tree.Limit;
import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.LiteralKind;
import com.whosly.sqlfp.tree.Parenthesized;
import com.whosly.sqlfp.tree.QualifiedName;
import com.whosly.sqlfp.tree.Query;
import com.whosly.sqlfp.tree.QuoteStyle;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectItem;
import com.whosly.sqlfp.tree.SortItem;
import com.whosly.sqlfp.tree.SqlNode;
import com.whosly.sqlfp.tree.Statement;
import com.whosly.sqlfp.tree.Table;
import com.whosly.sqlfp.tree.TreeRewriter;
import com.whosly.sqlfp.tree.UnaryOperation;
import com.whosly.sqlfp.tree.UnaryOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rewrites a statement into its canonical structural shape.
 *
 * Literal values are left untouched; only spelling that does not change
 * what the statement means is unified: parentheses, join keywords, ASC,
 * alias keywords, identifier quoting, function and type name case, and the
 * row limiting syntax.
 *
 * Instances hold per-call state and must not be shared.
 */
public class StructuralCanonicalizer extends TreeRewriter {

    private final SqlDialect dialect;
    private UnsupportedConstructException unsupported;

    public StructuralCanonicalizer(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public Statement canonicalize(Statement statement) throws UnsupportedConstructException {
        Statement result = rewrite(statement, Statement.class);
        if (unsupported != null) {
            throw unsupported;
        }
        return result;
    }

    private void reject(String construct) {
        if (unsupported == null) {
            unsupported = new UnsupportedConstructException(construct, dialect);
        }
    }

    // parentheses

    @Override
    public SqlNode visitParenthesized(Parenthesized node) {
        return rewrite(node.getExpression(), Expression.class);
    }

    @Override
    public SqlNode visitBinaryOperation(BinaryOperation node) {
        int precedence = node.getOperator().getPrecedence();
        Expression left = rewrite(node.getLeft(), Expression.class);
        Expression right = rewrite(node.getRight(), Expression.class);
        if (Precedence.of(left) < precedence) {
            left = new Parenthesized(left);
        }
        if (Precedence.of(right) <= precedence) {
            right = new Parenthesized(right);
        }
        return new BinaryOperation(node.getOperator(), left, right);
    }

    @Override
    public SqlNode visitUnaryOperation(UnaryOperation node) {
        Expression operand = rewrite(node.getOperand(), Expression.class);
        boolean signUnderSign = node.getOperator() != UnaryOperator.NOT
                && operand instanceof UnaryOperation
                && ((UnaryOperation) operand).getOperator() != UnaryOperator.NOT;
        if (signUnderSign || Precedence.of(operand) < node.getOperator().getPrecedence()) {
            operand = new Parenthesized(operand);
        }
        return new UnaryOperation(node.getOperator(), operand);
    }

    @Override
    public SqlNode visitIsPredicate(IsPredicate node) {
        Expression operand = predicateOperand(rewrite(node.getOperand(), Expression.class));
        return new IsPredicate(operand, node.isNegated(), node.getTarget());
    }

    @Override
    public SqlNode visitInListPredicate(InListPredicate node) {
        Expression operand = predicateOperand(rewrite(node.getOperand(), Expression.class));
        return new InListPredicate(operand, node.isNegated(), rewrite(node.getValues(), ExpressionList.class));
    }

    @Override
    public SqlNode visitInSubqueryPredicate(InSubqueryPredicate node) {
        Expression operand = predicateOperand(rewrite(node.getOperand(), Expression.class));
        return new InSubqueryPredicate(operand, node.isNegated(), rewrite(node.getSubquery(), Query.class));
    }

    @Override
    public SqlNode visitBetweenPredicate(BetweenPredicate node) {
        Expression operand = predicateOperand(rewrite(node.getOperand(), Expression.class));
        Expression low = predicateOperand(rewrite(node.getLow(), Expression.class));
        Expression high = predicateOperand(rewrite(node.getHigh(), Expression.class));
        return new BetweenPredicate(operand, node.isNegated(), low, high);
    }

    private static Expression predicateOperand(Expression operand) {
        return Precedence.of(operand) <= Precedence.PREDICATE ? new Parenthesized(operand) : operand;
    }

    // names and keywords

    @Override
    public SqlNode visitIdentifier(Identifier node) {
        return node.isQuoted() ? node.withQuoteStyle(dialect.getIdentifierQuote()) : node;
    }

    @Override
    public SqlNode visitColumnReference(ColumnReference node) {
        List<Identifier> parts = node.getName().getParts();
        if (parts.size() == 1) {
            Identifier name = parts.get(0);
            String upper = name.getValue().toUpperCase(Locale.ROOT);
            if (!name.isQuoted() && ("TRUE".equals(upper) || "FALSE".equals(upper))) {
                return new Literal(LiteralKind.BOOLEAN, upper);
            }
            if (name.getQuoteStyle() == QuoteStyle.DOUBLE_QUOTE && dialect.isDoubleQuotedStrings()) {
                return new Literal(LiteralKind.STRING, "\"" + name.getValue().replace("\"", "\"\"") + "\"");
            }
        }
        return super.visitColumnReference(node);
    }

    @Override
    public SqlNode visitFunctionCall(FunctionCall node) {
        FunctionCall call = (FunctionCall) super.visitFunctionCall(node);
        List<Identifier> parts = new ArrayList<>();
        for (Identifier part : call.getName().getParts()) {
            parts.add(part.isQuoted() ? part : Identifier.unquoted(part.getValue().toUpperCase(Locale.ROOT)));
        }
        return new FunctionCall(new QualifiedName(parts), call.isDistinct(), call.getArguments(), call.getFilter(),
                call.getWindow());
    }

    @Override
    public SqlNode visitDataType(DataType node) {
        String name = node.getName();
        boolean quoted = name.indexOf('"') >= 0 || name.indexOf('`') >= 0 || name.indexOf('[') >= 0;
        return quoted ? node : new DataType(name.toUpperCase(Locale.ROOT));
    }

    @Override
    public SqlNode visitKeywordExpression(KeywordExpression node) {
        return new KeywordExpression(node.getKeyword().toUpperCase(Locale.ROOT));
    }

    @Override
    public SqlNode visitExtractExpression(ExtractExpression node) {
        Expression source = rewrite(node.getSource(), Expression.class);
        return new ExtractExpression(node.getField().toUpperCase(Locale.ROOT), source);
    }

    // clauses

    @Override
    public SqlNode visitSelect(Select node) {
        if (node.getTop() != null && !dialect.supportsTop()) {
            reject("TOP");
        }
        return super.visitSelect(node);
    }

    @Override
    public SqlNode visitSelectItem(SelectItem node) {
        Expression expression = rewrite(node.getExpression(), Expression.class);
        return new SelectItem(expression, alias(node.getAlias(), true));
    }

    @Override
    public SqlNode visitTable(Table node) {
        QualifiedName name = rewrite(node.getName(), QualifiedName.class);
        return new Table(name, alias(node.getAlias(), false));
    }

    @Override
    public SqlNode visitDerivedTable(DerivedTable node) {
        return new DerivedTable(rewrite(node.getQuery(), Query.class), alias(node.getAlias(), false));
    }

    private Alias alias(Alias alias, boolean explicitAs) {
        return alias == null ? null : new Alias(rewrite(alias.getName(), Identifier.class), explicitAs);
    }

    @Override
    public SqlNode visitJoin(Join node) {
        Join join = (Join) super.visitJoin(node);
        return new Join(join.getType(), false, join.getLeft(), join.getRight(), join.getCondition(), join.getUsing());
    }

    @Override
    public SqlNode visitSortItem(SortItem node) {
        SortItem.Ordering ordering = node.getOrdering() == SortItem.Ordering.ASC
                ? SortItem.Ordering.UNSPECIFIED
                : node.getOrdering();
        return new SortItem(rewrite(node.getExpression(), Expression.class), ordering, node.getNullOrdering());
    }

    @Override
    public SqlNode visitLimit(Limit node) {
        Limit limit = (Limit) super.visitLimit(node);
        return new Limit(limit.getRowCount(), limit.getOffset(), dialect.getLimitStyle());
    }
}
