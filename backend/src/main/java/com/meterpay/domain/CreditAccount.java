package com.meterpay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Standing USD credit balance per (payer, service). balance = totalPurchased - totalSpent, never negative.
 */
@Document(collection = "credit_accounts")
@CompoundIndex(name = "payer_service", def = "{'payerAddress': 1, 'serviceId': 1, 'serviceType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CreditAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String payerAddress;
    private String serviceId;
    private ServiceType serviceType;
    private BigDecimal balance;
    private BigDecimal totalPurchased;
    private BigDecimal totalSpent;
    private String lastTopupSignature;
    private BigDecimal lastTopupAmount;
    private Instant lastTopupAt;
    private boolean autoTopupEnabled;
    private BigDecimal autoTopupThreshold;
    private BigDecimal autoTopupAmount;
    private Instant createdAt;
    private Instant updatedAt;
}
