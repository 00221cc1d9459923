package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.UnsupportedConstructException;
import com.whosly.sqlfp.tree.Alias;
import com.whosly.sqlfp.tree.BinaryOperation;
import com.whosly.sqlfp.tree.BinaryOperator;
import com.whosly.sqlfp.tree.CastExpression;
import com.whosly.sqlfp.tree.ColumnReference;
import com.whosly.sqlfp.tree.DataType;
import com.whosly.sqlfp.tree.Expression;
import com.whosly.sqlfp.tree.FunctionCall;
import com.whosly.sqlfp.tree.Identifier;
import com.whosly.sqlfp.tree.IsPredicate;
import com.whosly.sqlfp.tree.Join;
import com.whosly.sqlfp.tree.Limit;
import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.LiteralKind;
import com.whosly.sqlfp.tree.OrderBy;
import com.whosly.sqlfp.tree.Parenthesized;
import com.whosly.sqlfp.tree.QualifiedName;
import com.whosly.sqlfp.tree.Query;
import com.whosly.sqlfp.tree.QuoteStyle;
import com.whosly.sqlfp.tree.Relation;
import com.whosly.sqlfp.tree.Select;
import com.whosly.sqlfp.tree.SelectItem;
import com.whosly.sqlfp.tree.SelectStatement;
import com.whosly.sqlfp.tree.SortItem;
import com.whosly.sqlfp.tree.Statement;
import com.whosly.sqlfp.tree.Table;
import com.whosly.sqlfp.tree.Top;
import com.whosly.sqlfp.tree.UnaryOperation;
import com.whosly.sqlfp.tree.UnaryOperator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StructuralCanonicalizerTest {

    private static ColumnReference col(String name) {
        return new ColumnReference(QualifiedName.of(name));
    }

    private static Literal num(String text) {
        return new Literal(LiteralKind.NUMERIC, text);
    }

    private static BinaryOperation op(BinaryOperator operator, Expression left, Expression right) {
        return new BinaryOperation(operator, left, right);
    }

    private static Statement where(Expression condition) {
        Select select = new Select(false, null, List.of(new SelectItem(col("a"), null)),
                new Table(QualifiedName.of("t"), null), condition, null, null, false);
        return new SelectStatement(Query.simple(select));
    }

    private static Statement selectList(Expression... items) {
        List<SelectItem> selectItems = new ArrayList<>();
        for (Expression item : items) {
            selectItems.add(new SelectItem(item, null));
        }
        return new SelectStatement(Query.simple(new Select(false, null, selectItems, null, null, null, null, false)));
    }

    private static String canonical(Statement statement, SqlDialect dialect) throws UnsupportedConstructException {
        return new CanonicalRenderer().render(new StructuralCanonicalizer(dialect).canonicalize(statement));
    }

    @Test
    void testRedundantParenthesesAreRemoved() throws UnsupportedConstructException {
        Expression condition = new Parenthesized(new Parenthesized(op(BinaryOperator.EQUAL, col("a"), num("1"))));

        assertThat(canonical(where(condition), SqlDialect.GENERIC)).isEqualTo("SELECT a FROM t WHERE a = 1");
    }

    @Test
    void testRequiredParenthesesAreKept() throws UnsupportedConstructException {
        Expression or = op(BinaryOperator.OR, op(BinaryOperator.EQUAL, col("a"), num("1")),
                op(BinaryOperator.EQUAL, col("b"), num("2")));
        Expression condition = op(BinaryOperator.AND, new Parenthesized(or), op(BinaryOperator.EQUAL, col("c"), num("3")));

        assertThat(canonical(where(condition), SqlDialect.GENERIC))
                .isEqualTo("SELECT a FROM t WHERE (a = 1 OR b = 2) AND c = 3");
    }

    @Test
    void testParenthesesFollowAssociativity() throws UnsupportedConstructException {
        Expression leftGrouped = op(BinaryOperator.MINUS, new Parenthesized(op(BinaryOperator.MINUS, col("a"), col("b"))),
                col("c"));
        Expression rightGrouped = op(BinaryOperator.MINUS, col("a"),
                new Parenthesized(op(BinaryOperator.MINUS, col("b"), col("c"))));
        Expression product = op(BinaryOperator.MULTIPLY, op(BinaryOperator.PLUS, col("a"), col("b")), col("c"));

        assertThat(canonical(selectList(leftGrouped, rightGrouped, product), SqlDialect.GENERIC))
                .isEqualTo("SELECT a - b - c, a - (b - c), (a + b) * c");
    }

    @Test
    void testUnaryAndPredicateOperands() throws UnsupportedConstructException {
        Expression doubleMinus = new UnaryOperation(UnaryOperator.MINUS, new UnaryOperation(UnaryOperator.MINUS, col("x")));
        Expression negatedSum = new UnaryOperation(UnaryOperator.MINUS, op(BinaryOperator.PLUS, col("x"), col("y")));
        Expression isTrue = new IsPredicate(op(BinaryOperator.EQUAL, col("a"), col("b")), false, IsPredicate.Target.TRUE);

        assertThat(canonical(selectList(doubleMinus, negatedSum, isTrue), SqlDialect.GENERIC))
                .isEqualTo("SELECT -(-x), -(x + y), (a = b) IS TRUE");
    }

    @Test
    void testQuotedIdentifiersFollowDialect() throws UnsupportedConstructException {
        Select select = new Select(false, null, List.of(new SelectItem(col("a"), null)),
                new Table(QualifiedName.of(new Identifier("order items", QuoteStyle.DOUBLE_QUOTE)), null),
                null, null, null, false);
        Statement statement = new SelectStatement(Query.simple(select));

        assertThat(canonical(statement, SqlDialect.MSSQL)).isEqualTo("SELECT a FROM [order items]");
        assertThat(canonical(statement, SqlDialect.MYSQL)).isEqualTo("SELECT a FROM `order items`");
        assertThat(canonical(statement, SqlDialect.ORACLE)).isEqualTo("SELECT a FROM \"order items\"");
    }

    @Test
    void testBooleanIdentifiersBecomeLiterals() throws UnsupportedConstructException {
        Statement canonical = new StructuralCanonicalizer(SqlDialect.POSTGRESQL).canonicalize(selectList(col("true")));
        Select select = (Select) ((SelectStatement) canonical).getQuery().getBody();

        assertThat(select.getItems().get(0).getExpression()).isInstanceOf(Literal.class);
        assertThat(((Literal) select.getItems().get(0).getExpression()).getText()).isEqualTo("TRUE");
    }

    @Test
    void testDoubleQuotedValueDependsOnDialect() throws UnsupportedConstructException {
        Expression quoted = new ColumnReference(QualifiedName.of(new Identifier("bob", QuoteStyle.DOUBLE_QUOTE)));
        Statement statement = where(op(BinaryOperator.EQUAL, col("name"), quoted));

        Statement generic = new StructuralCanonicalizer(SqlDialect.GENERIC).canonicalize(statement);
        PlaceholderRewriter rewriter = new PlaceholderRewriter("?");
        assertThat(new CanonicalRenderer().render(rewriter.substitute(generic)))
                .isEqualTo("SELECT a FROM t WHERE name = ?");
        assertThat(rewriter.getParams()).containsExactly("\"bob\"");

        assertThat(canonical(statement, SqlDialect.POSTGRESQL)).isEqualTo("SELECT a FROM t WHERE name = \"bob\"");
    }

    @Test
    void testNamesAndTypesAreUppercased() throws UnsupportedConstructException {
        FunctionCall count = new FunctionCall(QualifiedName.of("count"), false, List.of(col("id")), null);
        FunctionCall quoted = new FunctionCall(QualifiedName.of(new Identifier("myFn", QuoteStyle.DOUBLE_QUOTE)),
                false, List.of(), null);
        CastExpression cast = new CastExpression(col("a"), new DataType("varchar(10)"));

        assertThat(canonical(selectList(count, quoted, cast), SqlDialect.POSTGRESQL))
                .isEqualTo("SELECT COUNT(id), \"myFn\"(), CAST(a AS VARCHAR(10))");
    }

    @Test
    void testAliasesAndJoins() throws UnsupportedConstructException {
        Relation users = new Table(QualifiedName.of("users"), new Alias(Identifier.unquoted("u"), true));
        Relation orders = new Table(QualifiedName.of("orders"), new Alias(Identifier.unquoted("o"), false));
        Expression on = op(BinaryOperator.EQUAL, new ColumnReference(QualifiedName.of("u", "id")),
                new ColumnReference(QualifiedName.of("o", "user_id")));
        Join join = new Join(Join.Type.LEFT, true, users, orders, on, List.of());
        Select select = new Select(false, null,
                List.of(new SelectItem(new ColumnReference(QualifiedName.of("u", "name")),
                        new Alias(Identifier.unquoted("n"), false))),
                join, null, null, null, false);

        assertThat(canonical(new SelectStatement(Query.simple(select)), SqlDialect.GENERIC))
                .isEqualTo("SELECT u.name AS n FROM users u LEFT JOIN orders o ON u.id = o.user_id");
    }

    @Test
    void testAscIsDroppedAndLimitFollowsDialect() throws UnsupportedConstructException {
        Select select = new Select(false, null, List.of(new SelectItem(col("a"), null)),
                new Table(QualifiedName.of("t"), null), null, null, null, false);
        OrderBy orderBy = new OrderBy(List.of(
                new SortItem(col("a"), SortItem.Ordering.ASC, SortItem.NullOrdering.UNSPECIFIED),
                new SortItem(col("b"), SortItem.Ordering.DESC, SortItem.NullOrdering.FIRST)));
        Statement statement = new SelectStatement(new Query(null, select, orderBy,
                new Limit(num("10"), num("20"), Limit.Style.LIMIT_OFFSET)));

        assertThat(canonical(statement, SqlDialect.MYSQL))
                .isEqualTo("SELECT a FROM t ORDER BY a, b DESC NULLS FIRST LIMIT 10 OFFSET 20");
        assertThat(canonical(statement, SqlDialect.ORACLE))
                .isEqualTo("SELECT a FROM t ORDER BY a, b DESC NULLS FIRST OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY");
    }

    @Test
    void testTopOutsideMssqlIsRejected() throws UnsupportedConstructException {
        Select select = new Select(false, new Top(num("5"), false, false), List.of(new SelectItem(col("a"), null)),
                new Table(QualifiedName.of("t"), null), null, null, null, false);
        Statement statement = new SelectStatement(Query.simple(select));

        assertThat(canonical(statement, SqlDialect.MSSQL)).isEqualTo("SELECT TOP 5 a FROM t");

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> new StructuralCanonicalizer(SqlDialect.MYSQL).canonicalize(statement));
        assertThat(e.getConstruct()).isEqualTo("TOP");
        assertThat(e.getDialect()).isEqualTo(SqlDialect.MYSQL);
    }
}
