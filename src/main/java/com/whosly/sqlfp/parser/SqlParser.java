package com.whosly.sqlfp.parser;

import com.whosly.sqlfp.tree.Statement;

/**
 * Interface for SQL parsing functionality.
 *
 * Implementations turn SQL text into the engine's own read-only tree so the
 * normalization stages never depend on a particular parser library.
 */
public interface SqlParser {

    /**
     * Parse the first statement of a SQL string.
     *
     * @param sql the SQL string to parse
     * @param dialect the grammar to parse with
     * @return the parsed statement
     * @throws SqlParseException if the SQL cannot be parsed or holds no statement
     * @throws UnsupportedConstructException if the SQL parses but uses a construct the tree does not model
     */
    Statement parse(String sql, SqlDialect dialect) throws SqlParseException, UnsupportedConstructException;

    /**
     * Validate the syntax of a SQL statement.
     *
     * @param sql the SQL string to validate
     * @param dialect the grammar to validate against
     * @return true if {@link #parse(String, SqlDialect)} succeeds, false otherwise
     */
    boolean validate(String sql, SqlDialect dialect);
}
