package com.meterpay.analytics;

import java.math.BigDecimal;

/**
 * Headline usage figures for a payer, or for everyone when payerAddress is null.
 */
public record UsageOverview(String payerAddress,
                            BigDecimal totalRevenue,
                            long totalTransactions,
                            long activeSessions,
                            BigDecimal averageSessionValue,
                            BigDecimal successRate) {
}
