package com.whosly.sqlfp.config;

import com.whosly.sqlfp.normalize.SqlNormalizer;
import com.whosly.sqlfp.parser.DruidSqlParser;
import com.whosly.sqlfp.parser.SqlDialect;
import com.whosly.sqlfp.parser.SqlParser;
import com.whosly.sqlfp.parser.UnsupportedDialectException;
import com.whosly.sqlfp.service.FingerprintService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintConfigTest {

    private static AnnotationConfigApplicationContext context(Map<String, Object> properties) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
        context.register(FingerprintConfig.class, FingerprintService.class);
        return context;
    }

    @Test
    void testDefaults() {
        try (AnnotationConfigApplicationContext context = context(Map.of())) {
            context.refresh();

            assertThat(context.getBean(SqlParser.class)).isInstanceOf(DruidSqlParser.class);
            assertThat(context.getBean(SqlNormalizer.class)).isNotNull();

            FingerprintService service = context.getBean(FingerprintService.class);
            assertThat(service.getDefaultDialect()).isEqualTo(SqlDialect.GENERIC);
            assertThat(service.getPlaceholder()).isEqualTo("?");
        }
    }

    @Test
    void testConfiguredValues() {
        try (AnnotationConfigApplicationContext context =
                     context(Map.of("sqlfp.default-dialect", "postgres", "sqlfp.placeholder", "$?"))) {
            context.refresh();

            FingerprintConfig config = context.getBean(FingerprintConfig.class);
            assertThat(config.getDefaultDialect()).isEqualTo("postgres");

            FingerprintService service = context.getBean(FingerprintService.class);
            assertThat(service.getDefaultDialect()).isEqualTo(SqlDialect.POSTGRESQL);
            assertThat(service.getPlaceholder()).isEqualTo("$?");
        }
    }

    @Test
    void testInvalidDialectFailsStartup() {
        try (AnnotationConfigApplicationContext context = context(Map.of("sqlfp.default-dialect", "nosql"))) {
            assertThatThrownBy(context::refresh)
                    .isInstanceOf(BeanCreationException.class)
                    .hasRootCauseInstanceOf(UnsupportedDialectException.class);
        }
    }
}
