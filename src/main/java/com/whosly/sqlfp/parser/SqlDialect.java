package com.whosly.sqlfp.parser;

import com.whosly.sqlfp.tree.Limit;
import com.whosly.sqlfp.tree.QuoteStyle;

import java.util.Locale;

/**
 * Enum representing the SQL dialects understood by the fingerprint engine.
 *
 * Besides selecting the parser grammar, each dialect fixes the canonical
 * spelling of the few constructs it writes differently from the others.
 */
public enum SqlDialect {
    GENERIC("generic", "Generic", QuoteStyle.DOUBLE_QUOTE, true, Limit.Style.LIMIT_OFFSET),
    ANSI("ansi", "ANSI", QuoteStyle.DOUBLE_QUOTE, false, Limit.Style.OFFSET_FETCH),
    MYSQL("mysql", "MySQL", QuoteStyle.BACKTICK, true, Limit.Style.LIMIT_OFFSET),
    MARIADB("mariadb", "MariaDB", QuoteStyle.BACKTICK, true, Limit.Style.LIMIT_OFFSET),
    POSTGRESQL("postgresql", "PostgreSQL", QuoteStyle.DOUBLE_QUOTE, false, Limit.Style.LIMIT_OFFSET, "postgres"),
    SQLITE("sqlite", "SQLite", QuoteStyle.DOUBLE_QUOTE, false, Limit.Style.LIMIT_OFFSET),
    MSSQL("mssql", "SQL Server", QuoteStyle.BRACKET, false, Limit.Style.OFFSET_FETCH),
    ORACLE("oracle", "Oracle", QuoteStyle.DOUBLE_QUOTE, false, Limit.Style.OFFSET_FETCH);

    private final String key;
    private final String displayName;
    private final QuoteStyle identifierQuote;
    private final boolean doubleQuotedStrings;
    private final Limit.Style limitStyle;
    private final String[] aliases;

    SqlDialect(String name, String displayName, QuoteStyle identifierQuote, boolean doubleQuotedStrings,
               Limit.Style limitStyle, String... aliases) {
        this.key = name;
        this.displayName = displayName;
        this.identifierQuote = identifierQuote;
        this.doubleQuotedStrings = doubleQuotedStrings;
        this.limitStyle = limitStyle;
        this.aliases = aliases;
    }

    /**
     * Resolve a dialect from its name, ignoring case.
     *
     * @param value the dialect name, for example {@code "mysql"} or {@code "postgres"}
     * @return the dialect
     * @throws UnsupportedDialectException if the name is not recognised
     */
    public static SqlDialect fromName(String value) throws UnsupportedDialectException {
        if (value == null) {
            throw new UnsupportedDialectException(null);
        }
        String lookup = value.trim().toLowerCase(Locale.ROOT);
        for (SqlDialect dialect : values()) {
            if (dialect.key.equals(lookup)) {
                return dialect;
            }
            for (String alias : dialect.aliases) {
                if (alias.equals(lookup)) {
                    return dialect;
                }
            }
        }
        throw new UnsupportedDialectException(value);
    }

    public String getName() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the quote characters quoted identifiers are rewritten to
     */
    public QuoteStyle getIdentifierQuote() {
        return identifierQuote;
    }

    /**
     * @return whether a stand-alone double-quoted name in value position is a string
     */
    public boolean isDoubleQuotedStrings() {
        return doubleQuotedStrings;
    }

    public Limit.Style getLimitStyle() {
        return limitStyle;
    }

    public boolean supportsTop() {
        return this == MSSQL;
    }
}
