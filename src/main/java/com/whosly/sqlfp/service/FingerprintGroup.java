package com.whosly.sqlfp.service;

/**
 * Statements sharing one fingerprint.
 */
public class FingerprintGroup {

    private final String hash;
    private final String normalized;
    private final String firstOriginal;
    private int count;

    FingerprintGroup(String hash, String normalized, String firstOriginal) {
        this.hash = hash;
        this.normalized = normalized;
        this.firstOriginal = firstOriginal;
    }

    void increment() {
        count++;
    }

    public String getHash() {
        return hash;
    }

    public String getNormalized() {
        return normalized;
    }

    /**
     * @return the first statement of the batch that produced this fingerprint
     */
    public String getFirstOriginal() {
        return firstOriginal;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "FingerprintGroup(hash='" + hash.substring(0, Math.min(8, hash.length()))
                + "', count=" + count + ", normalized='" + normalized + "')";
    }
}
