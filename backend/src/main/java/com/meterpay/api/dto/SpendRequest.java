package com.meterpay.api.dto;

import com.meterpay.domain.ResourceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Body of POST /sessions/{token}/spend.
 */
public record SpendRequest(
        @NotNull(message = "INVALID_AMOUNT") @DecimalMin(value = "0", inclusive = false, message = "INVALID_AMOUNT") BigDecimal amount,
        @NotBlank(message = "INVALID_RESOURCE") String resourceUrl,
        ResourceType resourceType,
        String httpMethod) {
}
