package com.meterpay.api.dto;

import java.math.BigDecimal;

public record SpendResponse(String token, BigDecimal amountCharged, BigDecimal remainingAmount, String status) {
}
