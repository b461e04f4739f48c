package com.meterpay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit record of one submitted SOL transfer. Created PENDING right after submission;
 * only the confirmation monitor changes its status. Never deleted.
 */
@Document(collection = "transaction_logs")
@CompoundIndexes({
        @CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}"),
        @CompoundIndex(name = "payer_created", def = "{'payerAddress': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionRecord {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String signature;
    private String payerAddress;
    private TransactionKind kind;
    private TransactionStatus status;
    /** SOL transferred. */
    private BigDecimal nativeAmount;
    /** USD amount the transfer was priced from. */
    private BigDecimal referenceAmount;
    /** USD per SOL at submission time. */
    private BigDecimal rate;
    private PriceSource priceSource;
    private String recipientAddress;
    private Instant createdAt;
    private Instant confirmedAt;
    private String errorMessage;
}
