package com.meterpay.pricing;

import com.meterpay.domain.PriceSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * USD amount and its SOL equivalent at one rate. nativeAmount = referenceAmount / rate.
 */
public record PriceQuote(BigDecimal referenceAmount,
                         BigDecimal nativeAmount,
                         BigDecimal rate,
                         Instant asOf,
                         PriceSource source) {
}
