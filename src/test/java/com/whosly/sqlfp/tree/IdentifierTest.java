package com.whosly.sqlfp.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IdentifierTest {

    @Test
    void testParseQuotedNames() {
        Identifier backtick = Identifier.parse("`order`");
        assertThat(backtick.getValue()).isEqualTo("order");
        assertThat(backtick.getQuoteStyle()).isEqualTo(QuoteStyle.BACKTICK);

        Identifier bracket = Identifier.parse("[User Name]");
        assertThat(bracket.getValue()).isEqualTo("User Name");
        assertThat(bracket.getQuoteStyle()).isEqualTo(QuoteStyle.BRACKET);

        Identifier doubled = Identifier.parse("\"a\"\"b\"");
        assertThat(doubled.getValue()).isEqualTo("a\"b");
        assertThat(doubled.getQuoteStyle()).isEqualTo(QuoteStyle.DOUBLE_QUOTE);
    }

    @Test
    void testParseUnquotedNames() {
        Identifier plain = Identifier.parse("users");
        assertThat(plain.isQuoted()).isFalse();
        assertThat(plain.getValue()).isEqualTo("users");
        assertThat(plain.getKind()).isEqualTo(NodeKind.IDENTIFIER);

        // unbalanced delimiters are kept as written
        assertThat(Identifier.parse("`open").isQuoted()).isFalse();
        assertThat(Identifier.parse("x").getValue()).isEqualTo("x");
    }

    @Test
    void testWithQuoteStyle() {
        Identifier name = Identifier.parse("`col`");
        Identifier requoted = name.withQuoteStyle(QuoteStyle.DOUBLE_QUOTE);

        assertThat(requoted.getValue()).isEqualTo("col");
        assertThat(requoted.toString()).isEqualTo("\"col\"");
        assertThat(name.withQuoteStyle(QuoteStyle.BACKTICK)).isSameAs(name);
    }

    @Test
    void testQualifiedName() {
        QualifiedName name = QualifiedName.of("db", "users");
        assertThat(name.getParts()).hasSize(2);
        assertThat(name.getLast().getValue()).isEqualTo("users");

        assertThrows(IllegalArgumentException.class, () -> new QualifiedName(List.of()));
    }
}
