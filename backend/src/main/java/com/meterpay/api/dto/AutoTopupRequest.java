package com.meterpay.api.dto;

import com.meterpay.domain.ServiceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Body of PUT /credits/{wallet}/auto-topup.
 */
public record AutoTopupRequest(
        @NotBlank(message = "INVALID_SERVICE") String serviceId,
        @NotNull(message = "INVALID_SERVICE") ServiceType serviceType,
        @NotNull(message = "INVALID_AMOUNT") @DecimalMin(value = "0", message = "INVALID_AMOUNT") BigDecimal threshold,
        @NotNull(message = "INVALID_AMOUNT") @DecimalMin(value = "0", inclusive = false, message = "INVALID_AMOUNT") BigDecimal amount) {
}
