package com.meterpay.api.dto;

import com.meterpay.domain.CreditAccount;

import java.math.BigDecimal;
import java.time.Instant;

public record CreditAccountResponse(String payerAddress,
                                    String serviceId,
                                    String serviceType,
                                    BigDecimal balance,
                                    BigDecimal totalPurchased,
                                    BigDecimal totalSpent,
                                    boolean autoTopupEnabled,
                                    BigDecimal autoTopupThreshold,
                                    BigDecimal autoTopupAmount,
                                    String lastTopupSignature,
                                    Instant lastTopupAt,
                                    Instant updatedAt) {

    public static CreditAccountResponse from(CreditAccount a) {
        return new CreditAccountResponse(a.getPayerAddress(), a.getServiceId(),
                a.getServiceType() != null ? a.getServiceType().name() : null,
                a.getBalance(), a.getTotalPurchased(), a.getTotalSpent(),
                a.isAutoTopupEnabled(), a.getAutoTopupThreshold(), a.getAutoTopupAmount(),
                a.getLastTopupSignature(), a.getLastTopupAt(), a.getUpdatedAt());
    }
}
