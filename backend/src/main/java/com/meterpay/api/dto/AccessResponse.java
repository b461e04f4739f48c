package com.meterpay.api.dto;

import java.math.BigDecimal;

/**
 * 200 body of POST /metered/{serviceType}/{serviceId}/access.
 */
public record AccessResponse(boolean granted, String mode, BigDecimal amountCharged, BigDecimal remainingBalance,
                             String reference) {
}
