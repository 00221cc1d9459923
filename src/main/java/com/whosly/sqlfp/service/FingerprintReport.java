package com.whosly.sqlfp.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of fingerprinting a batch of statements.
 *
 * Groups keep the order in which their fingerprint was first seen.
 */
public class FingerprintReport {

    private final Map<String, FingerprintGroup> groups = new LinkedHashMap<>();
    private final List<Rejected> rejected = new ArrayList<>();

    void add(String hash, String normalized, String original) {
        groups.computeIfAbsent(hash, h -> new FingerprintGroup(h, normalized, original)).increment();
    }

    void reject(String sql, String message) {
        rejected.add(new Rejected(sql, message));
    }

    public List<FingerprintGroup> getGroups() {
        return List.copyOf(groups.values());
    }

    public FingerprintGroup getGroup(String hash) {
        return groups.get(hash);
    }

    public List<Rejected> getRejected() {
        return Collections.unmodifiableList(rejected);
    }

    /**
     * A statement that could not be fingerprinted.
     */
    public static class Rejected {

        private final String sql;
        private final String message;

        Rejected(String sql, String message) {
            this.sql = sql;
            this.message = message;
        }

        public String getSql() {
            return sql;
        }

        public String getMessage() {
            return message;
        }
    }
}
