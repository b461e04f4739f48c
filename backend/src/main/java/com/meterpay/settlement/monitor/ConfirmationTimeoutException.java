package com.meterpay.settlement.monitor;

/**
 * Polling window elapsed without a terminal ledger answer. The record stays PENDING.
 */
public class ConfirmationTimeoutException extends RuntimeException {

    public ConfirmationTimeoutException(String signature) {
        super("No confirmation for " + signature + " within the polling window");
    }
}
