package com.equixtate.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    @DisplayName("Valid EVM address accepted, surrounding whitespace ignored")
    void validEvmAddress() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(validator.isValidAddress("0x0000000000000000000000000000000000000000")).isTrue();
        assertThat(validator.isValidAddress(" 0x742d35Cc6634C0532925a3b844Bc454e4438f44e ")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
        assertThat(validator.isValidAddress("0x123")).isFalse();
        assertThat(validator.isValidAddress("nothex")).isFalse();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44g")).isFalse();
    }

    @Test
    @DisplayName("@WalletAddress treats null as valid and leaves presence to @NotBlank")
    void walletAddressConstraint() {
        WalletAddressValidator constraint = new WalletAddressValidator(validator);

        assertThat(constraint.isValid(null, null)).isTrue();
        assertThat(constraint.isValid("0x123", null)).isFalse();
        assertThat(constraint.isValid("0x742d35Cc6634C0532925a3b844Bc454e4438f44e", null)).isTrue();
    }
}
