package com.whosly.sqlfp.config;

import com.whosly.sqlfp.normalize.SqlNormalizer;
import com.whosly.sqlfp.parser.DruidSqlParser;
import com.whosly.sqlfp.parser.SqlParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FingerprintConfig {

    // dialect used when the caller names none
    @Value("${sqlfp.default-dialect:generic}")
    private String defaultDialect;

    @Value("${sqlfp.placeholder:?}")
    private String placeholder;

    @Bean
    public SqlParser sqlParser() {
        return new DruidSqlParser();
    }

    @Bean
    public SqlNormalizer sqlNormalizer(SqlParser sqlParser) {
        return new SqlNormalizer(sqlParser);
    }

    public String getDefaultDialect() {
        return defaultDialect;
    }

    public String getPlaceholder() {
        return placeholder;
    }
}
