package com.atomicswap.unit.htlc;

import static com.atomicswap.support.SwapFixtures.HASHLOCK;
import static com.atomicswap.support.SwapFixtures.SECRET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atomicswap.htlc.SecretVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SecretVerifierTest {

    private SecretVerifier secretVerifier;

    @BeforeEach
    void setUp() {
        secretVerifier = new SecretVerifier();
    }

    @Test
    @DisplayName("Known SHA-256 vector verifies")
    void verifiesKnownVector() {
        assertThat(secretVerifier.verify(SECRET, HASHLOCK)).isTrue();
    }

    @Test
    @DisplayName("Upper-case hashlock still verifies")
    void hashlockCaseInsensitive() {
        assertThat(secretVerifier.verify(SECRET, HASHLOCK.toUpperCase())).isTrue();
    }

    @Test
    @DisplayName("Wrong preimage does not verify")
    void wrongSecretFails() {
        assertThat(secretVerifier.verify("616264", HASHLOCK)).isFalse();
    }

    @Test
    @DisplayName("Truncated hashlock never verifies, even as a prefix of the digest")
    void truncatedHashlockFails() {
        assertThat(secretVerifier.verify(SECRET, HASHLOCK.substring(0, 62))).isFalse();
    }

    @Test
    @DisplayName("Malformed secrets return false instead of throwing")
    void malformedSecretFails() {
        assertThat(secretVerifier.verify(null, HASHLOCK)).isFalse();
        assertThat(secretVerifier.verify("", HASHLOCK)).isFalse();
        assertThat(secretVerifier.verify("abc", HASHLOCK)).isFalse();
        assertThat(secretVerifier.verify("zz", HASHLOCK)).isFalse();
    }

    @Test
    @DisplayName("hashlockOf returns lower-case hex of the digest")
    void hashlockOfSecret() {
        assertThat(secretVerifier.hashlockOf(SECRET)).isEqualTo(HASHLOCK);
        assertThat(secretVerifier.hashlockOf("ABCDEF")).isEqualTo(secretVerifier.hashlockOf("abcdef"));
    }

    @Test
    @DisplayName("hashlockOf rejects odd-length hex")
    void hashlockOfRejectsMalformed() {
        assertThatThrownBy(() -> secretVerifier.hashlockOf("abc")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Hashlock format is exactly 64 hex characters")
    void hashlockFormat() {
        assertThat(SecretVerifier.isValidHashlock(HASHLOCK)).isTrue();
        assertThat(SecretVerifier.isValidHashlock(HASHLOCK + "00")).isFalse();
        assertThat(SecretVerifier.isValidHashlock("g".repeat(64))).isFalse();
        assertThat(SecretVerifier.isValidHashlock(null)).isFalse();
        assertThat(SecretVerifier.normalizeHashlock(HASHLOCK.toUpperCase())).isEqualTo(HASHLOCK);
    }
}
