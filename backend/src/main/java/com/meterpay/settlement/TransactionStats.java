package com.meterpay.settlement;

import java.math.BigDecimal;

/**
 * Aggregate view of transaction_logs for one payer or for everyone.
 */
public record TransactionStats(long total,
                               long confirmed,
                               long failed,
                               long pending,
                               BigDecimal nativeVolume,
                               BigDecimal referenceVolume,
                               Double averageConfirmationSeconds) {
}
