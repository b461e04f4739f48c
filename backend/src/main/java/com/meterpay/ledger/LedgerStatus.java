package com.meterpay.ledger;

/**
 * Ledger view of a transaction signature at the time of the query.
 */
public record LedgerStatus(State state, String error) {

    public enum State {
        NOT_FOUND,
        PENDING,
        CONFIRMED,
        FAILED
    }

    public static LedgerStatus notFound() {
        return new LedgerStatus(State.NOT_FOUND, null);
    }

    public static LedgerStatus pending() {
        return new LedgerStatus(State.PENDING, null);
    }

    public static LedgerStatus confirmed() {
        return new LedgerStatus(State.CONFIRMED, null);
    }

    public static LedgerStatus failed(String error) {
        return new LedgerStatus(State.FAILED, error);
    }
}
