package com.meterpay.protocol;

import lombok.Getter;

/**
 * Metered access refused for a reason other than missing payment.
 */
@Getter
public class PaymentGateException extends RuntimeException {

    public enum Code {
        SERVICE_NOT_FOUND,
        SERVICE_INACTIVE,
        PAYMENTS_NOT_ACCEPTED,
        PROOF_NOT_FOUND,
        PROOF_FAILED,
        WRONG_PAYER,
        WRONG_RECIPIENT,
        UNDERPAID,
        PROOF_REUSED
    }

    private final Code code;

    public PaymentGateException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public String getErrorCode() {
        return code.name();
    }
}
