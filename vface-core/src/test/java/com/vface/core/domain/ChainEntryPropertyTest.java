package com.vface.core.domain;

import com.vface.core.crypto.Hashing;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;

import static org.assertj.core.api.Assertions.*;

class ChainEntryPropertyTest {

    @Property(tries = 100)
    void hashInputBindsEveryField(
            @ForAll @LongRange(min = 1, max = 1_000_000) long index,
            @ForAll("hashes") String commitment,
            @ForAll("hashes") String fingerprint,
            @ForAll @LongRange(min = 0, max = 4_102_444_800_000L) long timestamp,
            @ForAll("hashes") String prevHash) {
        String input = ChainEntry.hashInput(index, commitment, fingerprint, timestamp, prevHash);

        assertThat(input).isEqualTo(index + "|" + commitment + "|" + fingerprint + "|" + timestamp + "|" + prevHash);
        assertThat(Hashing.sha256Hex(input))
                .isNotEqualTo(Hashing.sha256Hex(ChainEntry.hashInput(index + 1, commitment, fingerprint, timestamp, prevHash)))
                .isNotEqualTo(Hashing.sha256Hex(ChainEntry.hashInput(index, commitment, fingerprint, timestamp + 1, prevHash)));
    }

    @Example
    void entryStartsAtIndexOne() {
        assertThatThrownBy(() -> ChainEntry.create(0, "c", "f", 1L, "p", "h", "s"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void genesisHashMatchesSeed() {
        assertThat(Hashing.sha256Hex("vface-genesis-v3"))
                .isEqualTo("c41b5c688c2924f1fd5629860e73e1d3b025202c3d0402956e03c45b5521c409");
    }

    @Provide
    Arbitrary<String> hashes() {
        return Arbitraries.strings().withChars("0123456789abcdef").ofLength(64);
    }
}
