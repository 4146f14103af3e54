package com.vface.core.crypto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HashingTest {

    @Test
    void recognizesLowercaseSha256Hex() {
        assertThat(Hashing.isSha256Hex("a".repeat(64))).isTrue();
        assertThat(Hashing.isSha256Hex("A".repeat(64))).isFalse();
        assertThat(Hashing.isSha256Hex("a".repeat(63))).isFalse();
        assertThat(Hashing.isSha256Hex("g".repeat(64))).isFalse();
        assertThat(Hashing.isSha256Hex(null)).isFalse();
    }

    @Test
    void randomHexHasRequestedLength() {
        String nonce = Hashing.randomHex(32);

        assertThat(nonce).hasSize(64);
        assertThat(Hashing.isSha256Hex(nonce)).isTrue();
        assertThat(Hashing.randomHex(32)).isNotEqualTo(nonce);
    }
}
