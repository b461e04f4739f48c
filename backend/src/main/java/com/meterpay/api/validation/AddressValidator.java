package com.meterpay.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates wallet addresses and transaction signatures (Solana base58).
 */
@Component
public class AddressValidator {

    /** Base58 public key: 32-44 chars. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");
    /** Base58 signature: 64 bytes encode to 86-88 chars. */
    private static final Pattern SOLANA_SIGNATURE = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{64,90}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return SOLANA_ADDRESS.matcher(address.trim()).matches();
    }

    public boolean isValidSignature(String signature) {
        if (signature == null || signature.isBlank()) return false;
        return SOLANA_SIGNATURE.matcher(signature.trim()).matches();
    }
}
