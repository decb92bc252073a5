package com.equixtate.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Wallet principal format check shared by request validation and path variables.
 * Principals are EVM addresses because the oracle encodes the owner as an address word.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }
}
