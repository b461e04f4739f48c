package com.meterpay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for payment_sessions.
 */
public interface PaymentSessionRepository
        extends MongoRepository<PaymentSession, String>, PaymentSessionRepositoryCustom {

    Optional<PaymentSession> findByToken(String token);

    List<PaymentSession> findByPayerAddressOrderByCreatedAtDesc(String payerAddress);

    List<PaymentSession> findByPayerAddress(String payerAddress);

    long countByStatus(SessionStatus status);

    long countByPayerAddressAndStatus(String payerAddress, SessionStatus status);
}
