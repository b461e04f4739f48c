package com.meterpay.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 402 body telling the caller what to pay and where.
 */
public record PaymentRequiredBody(String error,
                                  String message,
                                  BigDecimal amount,
                                  String currency,
                                  String recipient,
                                  String resourcePattern,
                                  String header,
                                  Instant timestamp) {
}
