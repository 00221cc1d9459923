package com.whosly.sqlfp.normalize;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of normalizing one statement.
 */
public final class NormalizeResult {

    private static final int SUMMARY_LENGTH = 50;

    private final String original;
    private final String normalized;
    private final String hash;
    private final List<String> params;

    private NormalizeResult(String original, String normalized, String hash, List<String> params) {
        this.original = original;
        this.normalized = normalized;
        this.hash = hash;
        this.params = params;
    }

    /**
     * Assemble a result. {@code params} is copied; nothing else is transformed.
     */
    public static NormalizeResult of(String original, String normalized, String hash, List<String> params) {
        return new NormalizeResult(
                Objects.requireNonNull(original, "original"),
                Objects.requireNonNull(normalized, "normalized"),
                Objects.requireNonNull(hash, "hash"),
                List.copyOf(params));
    }

    /**
     * @return the input text, unmodified
     */
    public String getOriginal() {
        return original;
    }

    /**
     * @return the canonical single-line text with literals replaced
     */
    public String getNormalized() {
        return normalized;
    }

    /**
     * @return 64 lowercase hex characters, the SHA-256 of {@link #getNormalized()}
     */
    public String getHash() {
        return hash;
    }

    /**
     * @return the literal texts in placeholder order, duplicates included
     */
    public List<String> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizeResult)) {
            return false;
        }
        NormalizeResult that = (NormalizeResult) o;
        return original.equals(that.original)
                && normalized.equals(that.normalized)
                && hash.equals(that.hash)
                && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, normalized, hash, params);
    }

    @Override
    public String toString() {
        String summary = normalized.length() > SUMMARY_LENGTH
                ? normalized.substring(0, SUMMARY_LENGTH) + "..."
                : normalized;
        return "NormalizeResult(hash='" + hash.substring(0, Math.min(8, hash.length()))
                + "', normalized='" + summary + "')";
    }
}
