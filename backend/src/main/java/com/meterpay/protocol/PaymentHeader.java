package com.meterpay.protocol;

import java.math.BigDecimal;

/**
 * Payment evidence carried on a metered request. Exactly one of sessionToken / proof is normally set.
 */
public record PaymentHeader(String sessionToken,
                            String walletAddress,
                            BigDecimal amount,
                            String currency,
                            long timestamp,
                            String proof,
                            String signature) {

    public boolean hasSession() {
        return sessionToken != null && !sessionToken.isBlank();
    }

    public boolean hasProof() {
        return proof != null && !proof.isBlank();
    }
}
