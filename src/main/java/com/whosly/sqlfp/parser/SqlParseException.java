package com.whosly.sqlfp.parser;

/**
 * Exception thrown when SQL parsing fails.
 */
public class SqlParseException extends SqlFingerprintException {

    public SqlParseException(String message) {
        super(message);
    }

    public SqlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
