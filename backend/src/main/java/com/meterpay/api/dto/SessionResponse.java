package com.meterpay.api.dto;

import com.meterpay.domain.PaymentSession;

import java.math.BigDecimal;
import java.time.Instant;

public record SessionResponse(String token,
                              String payerAddress,
                              String resourcePattern,
                              BigDecimal authorizedAmount,
                              BigDecimal spentAmount,
                              BigDecimal remainingAmount,
                              String status,
                              Instant expiresAt,
                              boolean autoRenew,
                              String openingTransaction,
                              Instant lastUsedAt,
                              Instant createdAt) {

    public static SessionResponse from(PaymentSession s) {
        return new SessionResponse(s.getToken(), s.getPayerAddress(), s.getResourcePattern(),
                s.getAuthorizedAmount(), s.getSpentAmount(), s.getRemainingAmount(),
                s.getStatus() != null ? s.getStatus().name() : null,
                s.getExpiresAt(), s.isAutoRenew(), s.getOpeningTransaction(), s.getLastUsedAt(), s.getCreatedAt());
    }
}
