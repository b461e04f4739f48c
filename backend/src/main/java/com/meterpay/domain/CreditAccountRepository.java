package com.meterpay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for credit_accounts.
 */
public interface CreditAccountRepository extends MongoRepository<CreditAccount, String>, CreditAccountRepositoryCustom {

    Optional<CreditAccount> findByPayerAddressAndServiceIdAndServiceType(
            String payerAddress, String serviceId, ServiceType serviceType);

    List<CreditAccount> findByPayerAddressOrderByUpdatedAtDesc(String payerAddress);
}
