package com.meterpay.api.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    void acceptsBase58PublicKeys() {
        assertThat(validator.isValidAddress("11111111111111111111111111111111")).isTrue();
        assertThat(validator.isValidAddress("So11111111111111111111111111111111111111112")).isTrue();
        assertThat(validator.isValidAddress("  EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v ")).isTrue();
    }

    @Test
    void rejectsNonBase58AndWrongLength() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress(" ")).isFalse();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress("O0Il1111111111111111111111111111111")).isFalse();
        assertThat(validator.isValidAddress("1111111111")).isFalse();
    }

    @Test
    void signatures() {
        String signature = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";
        assertThat(validator.isValidSignature(signature)).isTrue();
        assertThat(validator.isValidSignature("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v")).isFalse();
        assertThat(validator.isValidSignature(null)).isFalse();
    }
}
