package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlFingerprintException;
import com.whosly.sqlfp.parser.SqlParser;
import com.whosly.sqlfp.tree.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the engine: parse, canonicalize, substitute literals,
 * render and hash.
 *
 * Holds no state besides the parser, so one instance may serve any number
 * of threads.
 */
public class SqlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SqlNormalizer.class);

    /**
     * Version of the canonicalization rules. Bump it together with the
     * reference corpus whenever {@code normalized} changes for an existing input.
     */
    public static final String RULE_SET_VERSION = "1";

    public static final String DEFAULT_PLACEHOLDER = "?";

    private final SqlParser parser;

    public SqlNormalizer(SqlParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public NormalizeResult normalize(String sql) throws SqlFingerprintException {
        return normalize(sql, SqlDialect.GENERIC, DEFAULT_PLACEHOLDER);
    }

    public NormalizeResult normalize(String sql, SqlDialect dialect) throws SqlFingerprintException {
        return normalize(sql, dialect, DEFAULT_PLACEHOLDER);
    }

    /**
     * Resolve the dialect by name, then normalize. An unknown name fails
     * before anything is parsed.
     */
    public NormalizeResult normalize(String sql, String dialectName, String placeholder)
            throws SqlFingerprintException {
        return normalize(sql, SqlDialect.fromName(dialectName), placeholder);
    }

    /**
     * Normalize one statement.
     *
     * @param sql         the statement text; when it holds several statements only the first is used
     * @param dialect     grammar and canonical spelling to apply
     * @param placeholder text every literal is replaced by, emitted verbatim
     * @return the normalized text, its hash and the extracted literals
     * @throws SqlFingerprintException if the input cannot be parsed or holds a construct
     *                                 the dialect has no rule for
     */
    public NormalizeResult normalize(String sql, SqlDialect dialect, String placeholder)
            throws SqlFingerprintException {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(placeholder, "placeholder");

        Statement parsed = parser.parse(sql, dialect);
        Statement canonical = new StructuralCanonicalizer(dialect).canonicalize(parsed);

        PlaceholderRewriter rewriter = new PlaceholderRewriter(placeholder);
        Statement substituted = rewriter.substitute(canonical);

        String normalized = new CanonicalRenderer().render(substituted);
        String hash = FingerprintHasher.sha256Hex(normalized);
        log.debug("Normalized {} statement to {} ({} params)", dialect.getDisplayName(), normalized,
                rewriter.getParams().size());
        return NormalizeResult.of(sql, normalized, hash, rewriter.getParams());
    }
}
