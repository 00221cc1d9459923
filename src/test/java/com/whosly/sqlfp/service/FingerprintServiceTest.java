package com.whosly.sqlfp.service;

import com.whosly.sqlfp.normalize.NormalizeResult;
import com.whosly.sqlfp.normalize.SqlNormalizer;
import com.whosly.sqlfp.parser.DruidSqlParser;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlFingerprintException;
import com.whosly.sqlfp.parser.UnsupportedDialectException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FingerprintServiceTest {

    private final FingerprintService service =
            new FingerprintService(new SqlNormalizer(new DruidSqlParser()), SqlDialect.MYSQL, "?");

    @Test
    void testFingerprintUsesDefaults() throws SqlFingerprintException {
        NormalizeResult result = service.fingerprint("SELECT `a` FROM `t` LIMIT 5, 10");

        assertThat(result.getNormalized()).isEqualTo("SELECT `a` FROM `t` LIMIT ? OFFSET ?");
        assertThat(result.getParams()).containsExactly("10", "5");
    }

    @Test
    void testFingerprintWithNamedDialect() throws SqlFingerprintException {
        NormalizeResult result = service.fingerprint("SELECT TOP 3 id FROM t", "mssql");

        assertThat(result.getNormalized()).isEqualTo("SELECT TOP ? id FROM t");
        assertThrows(UnsupportedDialectException.class, () -> service.fingerprint("SELECT 1", "db2000"));
    }

    @Test
    void testGroupByFingerprint() {
        FingerprintReport report = service.group(List.of(
                "SELECT id FROM users WHERE id = 42",
                "SELECT * FROM orders WHERE total > 10",
                "SELECT id FROM users WHERE id = 999",
                "NOT VALID SQL AT ALL",
                "select id from users where id = 7"));

        assertThat(report.getGroups()).hasSize(2);
        FingerprintGroup users = report.getGroups().get(0);
        assertThat(users.getNormalized()).isEqualTo("SELECT id FROM users WHERE id = ?");
        assertThat(users.getCount()).isEqualTo(3);
        assertThat(users.getFirstOriginal()).isEqualTo("SELECT id FROM users WHERE id = 42");
        assertThat(report.getGroup(users.getHash())).isSameAs(users);

        assertThat(report.getGroups().get(1).getCount()).isEqualTo(1);

        assertThat(report.getRejected()).hasSize(1);
        assertThat(report.getRejected().get(0).getSql()).isEqualTo("NOT VALID SQL AT ALL");
        assertThat(report.getRejected().get(0).getMessage()).startsWith("Parse error: ");
    }

    @Test
    void testEmptyBatch() {
        FingerprintReport report = service.group(List.of());

        assertThat(report.getGroups()).isEmpty();
        assertThat(report.getRejected()).isEmpty();
    }

    @Test
    void testNullStatementIsRejectedWithoutAbortingBatch() {
        FingerprintReport report = service.group(Arrays.asList(
                "SELECT id FROM users WHERE id = 1",
                null,
                "SELECT id FROM users WHERE id = 2"));

        assertThat(report.getGroups()).hasSize(1);
        assertThat(report.getGroups().get(0).getCount()).isEqualTo(2);
        assertThat(report.getRejected()).hasSize(1);
        assertThat(report.getRejected().get(0).getSql()).isNull();
        assertThat(report.getRejected().get(0).getMessage()).isEqualTo("SQL is null");
    }
}
