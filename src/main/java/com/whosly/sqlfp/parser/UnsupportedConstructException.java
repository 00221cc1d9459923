package com.whosly.sqlfp.parser;

/**
 * Thrown when a statement parses but contains a construct that has no
 * canonical form for the chosen dialect.
 */
public class UnsupportedConstructException extends SqlFingerprintException {

    private final String construct;
    private final SqlDialect dialect;

    public UnsupportedConstructException(String construct, SqlDialect dialect) {
        super("Unsupported construct for " + dialect.getDisplayName() + " dialect: " + construct);
        this.construct = construct;
        this.dialect = dialect;
    }

    public String getConstruct() {
        return construct;
    }

    public SqlDialect getDialect() {
        return dialect;
    }
}
