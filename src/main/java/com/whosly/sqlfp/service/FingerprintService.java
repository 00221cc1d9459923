package com.whosly.sqlfp.service;

import com.whosly.sqlfp.config.FingerprintConfig;
import com.whosly.sqlfp.normalize.NormalizeResult;
import com.whosly.sqlfp.normalize.SqlNormalizer;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlFingerprintException;
import com.whosly.sqlfp.parser.UnsupportedDialectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Objects;

/**
 * Fingerprints statements with the configured dialect and placeholder.
 */
@Service
public class FingerprintService {

    private static final Logger log = LoggerFactory.getLogger(FingerprintService.class);

    private final SqlNormalizer normalizer;
    private final SqlDialect defaultDialect;
    private final String placeholder;

    @Autowired
    public FingerprintService(SqlNormalizer normalizer, FingerprintConfig config) throws UnsupportedDialectException {
        this(normalizer, SqlDialect.fromName(config.getDefaultDialect()), config.getPlaceholder());
    }

    public FingerprintService(SqlNormalizer normalizer, SqlDialect defaultDialect, String placeholder) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.defaultDialect = Objects.requireNonNull(defaultDialect, "defaultDialect");
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
    }

    public NormalizeResult fingerprint(String sql) throws SqlFingerprintException {
        return normalizer.normalize(sql, defaultDialect, placeholder);
    }

    public NormalizeResult fingerprint(String sql, String dialectName) throws SqlFingerprintException {
        return normalizer.normalize(sql, dialectName, placeholder);
    }

    /**
     * Fingerprint a batch and group it by hash.
     *
     * @param statements SQL texts in the default dialect
     * @return the groups in first-seen order, plus every statement that failed,
     *         null elements included
     */
    public FingerprintReport group(Collection<String> statements) {
        FingerprintReport report = new FingerprintReport();
        for (String sql : statements) {
            if (sql == null) {
                log.warn("Skipping null statement in batch");
                report.reject(null, "SQL is null");
                continue;
            }
            try {
                NormalizeResult result = fingerprint(sql);
                report.add(result.getHash(), result.getNormalized(), sql);
            } catch (SqlFingerprintException e) {
                log.warn("Skipping statement that cannot be fingerprinted: {} ({})", sql, e.getMessage());
                report.reject(sql, e.getMessage());
            }
        }
        log.debug("Grouped {} statements into {} fingerprints, {} rejected",
                statements.size(), report.getGroups().size(), report.getRejected().size());
        return report;
    }

    public SqlDialect getDefaultDialect() {
        return defaultDialect;
    }

    public String getPlaceholder() {
        return placeholder;
    }
}
