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
import java.time.LocalDate;

/**
 * Daily roll-up of usage per (date, serviceId, serviceType). serviceId is null for the all-services row.
 */
@Document(collection = "daily_usage_stats")
@CompoundIndex(name = "date_service", def = "{'date': 1, 'serviceId': 1, 'serviceType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DailyUsageStats {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private LocalDate date;
    private String serviceId;
    private ServiceType serviceType;
    private long totalTransactions;
    private BigDecimal totalVolume;
    private long uniquePayers;
    private BigDecimal avgTransactionAmount;
    /** Percentage of COMPLETED records, 0-100. */
    private BigDecimal successRate;
    private Long avgResponseTimeMs;
    private Instant updatedAt;
}
