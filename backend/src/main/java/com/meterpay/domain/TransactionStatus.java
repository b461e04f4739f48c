package com.meterpay.domain;

/**
 * Settlement status of a submitted payment. PENDING moves to CONFIRMED or FAILED, never back.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
