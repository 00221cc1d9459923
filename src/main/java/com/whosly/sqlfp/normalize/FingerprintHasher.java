package com.whosly.sqlfp.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over the UTF-8 bytes of the normalized text, as lowercase hex.
 */
public final class FingerprintHasher {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private FingerprintHasher() {
    }

    public static String sha256Hex(String normalized) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));

        char[] hex = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            hex[i * 2] = HEX[(hash[i] >> 4) & 0x0f];
            hex[i * 2 + 1] = HEX[hash[i] & 0x0f];
        }
        return new String(hex);
    }
}
