package com.whosly.sqlfp.tree;

import com.whosly.sqlfp.normalize.CanonicalRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TreeRewriterTest {

    private static InsertStatement upsert() {
        OnConflict onConflict = new OnConflict(List.of(new ColumnReference(QualifiedName.of("id"))), null, null,
                OnConflict.Action.DO_UPDATE,
                List.of(new Assignment(QualifiedName.of("n"), new Literal(LiteralKind.NUMERIC, "2"))), null);
        return new InsertStatement(InsertStatement.Verb.INSERT, false, QualifiedName.of("t"),
                List.of(QualifiedName.of("id")),
                List.of(new ExpressionList(List.of(new Literal(LiteralKind.NUMERIC, "1")))),
                null, false, List.of(), onConflict, List.of(new ColumnReference(QualifiedName.of("id"))));
    }

    @Test
    void testCopyKeepsEveryClause() {
        InsertStatement original = upsert();

        SqlNode copy = original.accept(new TreeRewriter() {
        });

        assertThat(copy).isInstanceOf(InsertStatement.class).isNotSameAs(original);
        assertThat(new CanonicalRenderer().render(copy)).isEqualTo(new CanonicalRenderer().render(original));
    }

    @Test
    void testLiteralsAreVisitedInRenderOrder() {
        StringBuilder seen = new StringBuilder();
        upsert().accept(new TreeRewriter() {
            @Override
            public SqlNode visitLiteral(Literal node) {
                seen.append(node.getText());
                return node;
            }
        });

        assertThat(seen.toString()).isEqualTo("12");
    }

    @Test
    void testChildOfWrongTypeIsReported() {
        TreeRewriter broken = new TreeRewriter() {
            @Override
            public SqlNode visitQualifiedName(QualifiedName node) {
                return new Literal(LiteralKind.STRING, "'" + node + "'");
            }
        };

        assertThrows(ClassCastException.class, () -> upsert().accept(broken));
    }
}
