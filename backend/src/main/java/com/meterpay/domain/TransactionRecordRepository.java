package com.meterpay.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for transaction_logs.
 */
public interface TransactionRecordRepository
        extends MongoRepository<TransactionRecord, String>, TransactionRecordRepositoryCustom {

    Optional<TransactionRecord> findBySignature(String signature);

    List<TransactionRecord> findByPayerAddressOrderByCreatedAtDesc(String payerAddress, Pageable pageable);

    List<TransactionRecord> findByPayerAddress(String payerAddress);

    /** Reconciliation scan: records still PENDING created inside the window (exclusive bounds). */
    List<TransactionRecord> findByStatusAndCreatedAtBetween(TransactionStatus status, Instant from, Instant to);

    long countByPayerAddressAndKind(String payerAddress, TransactionKind kind);
}
