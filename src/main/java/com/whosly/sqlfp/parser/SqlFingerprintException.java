package com.whosly.sqlfp.parser;

/**
 * Base class of every error raised while normalizing a statement.
 */
public class SqlFingerprintException extends Exception {

    public SqlFingerprintException(String message) {
        super(message);
    }

    public SqlFingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
