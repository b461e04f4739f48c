package com.meterpay.protocol;

import java.math.BigDecimal;

/**
 * Outcome of an authorized metered request.
 *
 * @param remainingBalance session balance after the charge; null for proof payments
 * @param reference        session token or proof signature the charge was made against
 */
public record AccessGrant(Mode mode, BigDecimal amountCharged, BigDecimal remainingBalance, String reference) {

    public enum Mode {
        SESSION,
        PROOF,
        /** Service price is zero; nothing was charged. */
        FREE
    }
}
