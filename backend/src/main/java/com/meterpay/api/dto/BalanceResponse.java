package com.meterpay.api.dto;

import java.math.BigDecimal;

public record BalanceResponse(String payerAddress, String serviceId, String serviceType, BigDecimal balance) {
}
