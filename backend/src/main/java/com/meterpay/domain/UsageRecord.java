package com.meterpay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One metered use of a resource. Session spends are logged here without an on-chain leg;
 * proof payments carry the verified transaction signature in paymentProof (unique, so a proof is accepted once).
 */
@Document(collection = "usage_records")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UsageRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String sessionId;
    @Indexed
    private String payerAddress;
    private String serviceId;
    private String resourceUrl;
    private ResourceType resourceType;
    private String httpMethod;
    private BigDecimal amountCharged;
    private String paymentHeader;
    @Indexed(unique = true, sparse = true)
    private String paymentProof;
    private UsageStatus status;
    private Integer responseCode;
    private Long responseTimeMs;
    private String errorMessage;
    @Indexed
    private Instant createdAt;
}
