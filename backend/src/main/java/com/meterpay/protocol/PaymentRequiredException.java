package com.meterpay.protocol;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Request carried no usable payment evidence. Mapped to HTTP 402 with the amount to pay.
 */
@Getter
public class PaymentRequiredException extends RuntimeException {

    private final BigDecimal requiredAmount;
    private final String currency;
    private final String recipient;
    private final String resourcePattern;

    public PaymentRequiredException(BigDecimal requiredAmount, String currency, String recipient, String resourcePattern) {
        super("Payment of " + requiredAmount.toPlainString() + " " + currency + " required");
        this.requiredAmount = requiredAmount;
        this.currency = currency;
        this.recipient = recipient;
        this.resourcePattern = resourcePattern;
    }
}
