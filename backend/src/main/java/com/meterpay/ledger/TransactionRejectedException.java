package com.meterpay.ledger;

import lombok.Getter;

/**
 * The ledger refused a submitted transaction (preflight or validation failure). Not an endpoint
 * fault, so the failover pool does not retry it.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final boolean insufficientFunds;

    public TransactionRejectedException(String message, boolean insufficientFunds) {
        super(message);
        this.insufficientFunds = insufficientFunds;
    }
}
