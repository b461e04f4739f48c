package com.meterpay.credit;

import java.math.BigDecimal;

/**
 * Credit totals across all of a payer's accounts.
 */
public record CreditStats(BigDecimal totalPurchased,
                          BigDecimal totalSpent,
                          BigDecimal balance,
                          int accountCount,
                          long topupCount) {
}
