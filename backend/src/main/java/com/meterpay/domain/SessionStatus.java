package com.meterpay.domain;

/**
 * Payment session lifecycle. Only ACTIVE can transition; the other states are terminal.
 */
public enum SessionStatus {
    ACTIVE,
    EXPIRED,
    REVOKED,
    DEPLETED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
