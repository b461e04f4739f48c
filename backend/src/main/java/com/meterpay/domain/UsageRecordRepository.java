package com.meterpay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for usage_records.
 */
public interface UsageRecordRepository extends MongoRepository<UsageRecord, String> {

    /** Records created in [from, to). */
    @Query("{ 'createdAt': { $gte: ?0, $lt: ?1 } }")
    List<UsageRecord> findCreatedIn(Instant from, Instant to);

    List<UsageRecord> findByPayerAddress(String payerAddress);

    List<UsageRecord> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    boolean existsByPaymentProof(String paymentProof);
}
