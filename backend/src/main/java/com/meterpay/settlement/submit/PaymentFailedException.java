package com.meterpay.settlement.submit;

import lombok.Getter;

/**
 * A payment could not be submitted. No transaction record exists for it.
 */
@Getter
public class PaymentFailedException extends RuntimeException {

    public enum Reason {
        /** Payer declined to sign. */
        REJECTED,
        /** Payer's SOL balance cannot cover amount plus fee. */
        INSUFFICIENT_FUNDS,
        /** No RPC endpoint could be reached. */
        NETWORK,
        /** Ledger refused the transaction for another reason. */
        LEDGER_REJECTED
    }

    private final Reason reason;

    public PaymentFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public PaymentFailedException(Reason reason, String message) {
        this(reason, message, null);
    }

    public String getErrorCode() {
        return "PAYMENT_" + reason.name();
    }
}
