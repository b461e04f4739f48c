package com.meterpay.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Compare-and-set status transitions for transaction_logs.
 */
public interface TransactionRecordRepositoryCustom {

    /**
     * Moves a PENDING record to CONFIRMED. Empty when the record is missing or already terminal.
     */
    Optional<TransactionRecord> markConfirmed(String signature, Instant confirmedAt);

    /**
     * Moves a PENDING record to FAILED. Empty when the record is missing or already terminal.
     */
    Optional<TransactionRecord> markFailed(String signature, String errorMessage);
}
