package com.meterpay.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Atomic balance mutations for credit_accounts.
 */
public interface CreditAccountRepositoryCustom {

    /**
     * Creates the account if missing, then adds {@code amount} to balance and totalPurchased.
     */
    CreditAccount credit(String payerAddress, String serviceId, ServiceType serviceType,
                         BigDecimal amount, String topupSignature, Instant now);

    /**
     * Subtracts {@code amount} from balance and adds it to totalSpent only when balance >= amount.
     * Empty when the account is missing or short of funds.
     */
    Optional<CreditAccount> debit(String payerAddress, String serviceId, ServiceType serviceType,
                                  BigDecimal amount, Instant now);

    /**
     * Sets the auto top-up flags on an existing account.
     */
    Optional<CreditAccount> updateAutoTopup(String payerAddress, String serviceId, ServiceType serviceType,
                                            boolean enabled, BigDecimal threshold, BigDecimal amount, Instant now);
}
