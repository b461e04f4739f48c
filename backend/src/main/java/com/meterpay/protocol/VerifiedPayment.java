package com.meterpay.protocol;

import java.math.BigDecimal;

/**
 * A proof transaction that passed verification.
 */
public record VerifiedPayment(String signature, String payerAddress, String recipientAddress,
                              long lamports, BigDecimal nativeAmount) {
}
