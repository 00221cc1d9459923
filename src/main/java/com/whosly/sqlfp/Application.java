package com.whosly.sqlfp;

import com.whosly.sqlfp.normalize.SqlNormalizer;
import com.whosly.sqlfp.service.FingerprintService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

/**
 * Main application class for the SQL Fingerprint Engine.
 *
 * Starts a non-web context that wires the normalizer and the fingerprint
 * service for embedding in ingestion pipelines.
 */
@SpringBootApplication
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    @Autowired
    private FingerprintService fingerprintService;

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
        log.info("SQL Fingerprint Engine started successfully");
    }

    @EventListener
    public void onApplicationEvent(ContextRefreshedEvent event) {
        log.info("Canonicalization rule set: v{}", SqlNormalizer.RULE_SET_VERSION);
        log.info("  Default dialect: {}", fingerprintService.getDefaultDialect().getDisplayName());
        log.info("  Placeholder: {}", fingerprintService.getPlaceholder());
    }
}
