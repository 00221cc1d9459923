package com.whosly.sqlfp.parser;

/**
 * Thrown when a dialect name is not one of the recognised values.
 */
public class UnsupportedDialectException extends SqlFingerprintException {

    private final String dialectName;

    public UnsupportedDialectException(String dialectName) {
        super("Unsupported dialect: " + dialectName);
        this.dialectName = dialectName;
    }

    public String getDialectName() {
        return dialectName;
    }
}
