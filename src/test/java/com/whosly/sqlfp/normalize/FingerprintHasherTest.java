package com.whosly.sqlfp.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintHasherTest {

    @Test
    void testKnownDigests() {
        assertThat(FingerprintHasher.sha256Hex(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(FingerprintHasher.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void testLowercaseHex() {
        String hash = FingerprintHasher.sha256Hex("SELECT id FROM users WHERE id = ?");

        assertThat(hash).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(FingerprintHasher.sha256Hex("SELECT id FROM users WHERE id = ?")).isEqualTo(hash);
        assertThat(FingerprintHasher.sha256Hex("SELECT id FROM users WHERE id = $")).isNotEqualTo(hash);
    }
}
