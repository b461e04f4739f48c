package com.meterpay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Preauthorized spending envelope funded by one upfront payment and drawn down per metered use.
 * remainingAmount = authorizedAmount - spentAmount at all times; both are only changed together by
 * the atomic debit in {@link PaymentSessionRepositoryImpl}.
 */
@Document(collection = "payment_sessions")
@CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PaymentSession {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String token;
    @Indexed
    private String payerAddress;
    private String resourcePattern;
    private BigDecimal authorizedAmount;
    private BigDecimal spentAmount;
    private BigDecimal remainingAmount;
    private SessionStatus status;
    private Instant expiresAt;
    private boolean autoRenew;
    private BigDecimal renewalAmount;
    /** Signature of the payment that funded the session. */
    private String openingTransaction;
    private Instant lastUsedAt;
    private Instant createdAt;
}
