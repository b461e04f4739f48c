package com.meterpay.api.dto;

import com.meterpay.domain.TransactionRecord;

import java.math.BigDecimal;
import java.time.Instant;

public record TransactionResponse(String signature,
                                  String payerAddress,
                                  String kind,
                                  String status,
                                  BigDecimal nativeAmount,
                                  BigDecimal referenceAmount,
                                  BigDecimal rate,
                                  String priceSource,
                                  String recipientAddress,
                                  Instant createdAt,
                                  Instant confirmedAt,
                                  String errorMessage) {

    public static TransactionResponse from(TransactionRecord r) {
        return new TransactionResponse(r.getSignature(), r.getPayerAddress(),
                r.getKind() != null ? r.getKind().name() : null,
                r.getStatus() != null ? r.getStatus().name() : null,
                r.getNativeAmount(), r.getReferenceAmount(), r.getRate(),
                r.getPriceSource() != null ? r.getPriceSource().name() : null,
                r.getRecipientAddress(), r.getCreatedAt(), r.getConfirmedAt(), r.getErrorMessage());
    }
}
