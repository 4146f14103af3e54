package com.vface.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for consumed nonce bookkeeping.
 */
class ConsumedNoncePropertyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Property(tries = 100)
    void consumedNonceExpiresAfterItsWindow(
            @ForAll("validNonces") String nonce,
            @ForAll @IntRange(min = 1, max = 3600) int windowSeconds) {
        ConsumedNonce consumed = ConsumedNonce.consume(
                nonce, "a".repeat(64), "revoke", NOW, NOW.plusSeconds(windowSeconds));

        assertThat(consumed.isNew()).isTrue();
        assertThat(consumed.getId()).isEqualTo(nonce);
        assertThat(consumed.isExpired(NOW)).isFalse();
        assertThat(consumed.isExpired(NOW.plusSeconds(windowSeconds))).isFalse();
        assertThat(consumed.isExpired(NOW.plusSeconds(windowSeconds + 1L))).isTrue();
    }

    @Property(tries = 50)
    void oversizedNoncesAreRejected(@ForAll @IntRange(min = 129, max = 400) int length) {
        assertThatThrownBy(() -> ConsumedNonce.consume(
                "n".repeat(length), "a".repeat(64), "revoke", NOW, NOW.plusSeconds(60)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds");
    }

    @Example
    void blankNonceIsRejected() {
        assertThatThrownBy(() -> ConsumedNonce.consume(" ", "a".repeat(64), "revoke", NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void expiryBeforeConsumptionIsRejected() {
        assertThatThrownBy(() -> ConsumedNonce.consume(
                "abc", "a".repeat(64), "revoke", NOW, NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expire before");
    }

    @Provide
    Arbitrary<String> validNonces() {
        return Arbitraries.strings().withCharRange('a', 'z').numeric().ofMinLength(8).ofMaxLength(128);
    }
}
