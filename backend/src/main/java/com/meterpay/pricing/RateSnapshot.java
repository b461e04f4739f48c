package com.meterpay.pricing;

import com.meterpay.domain.PriceSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * USD per SOL as observed at {@code fetchedAt} from {@code source}.
 */
public record RateSnapshot(BigDecimal rate, Instant fetchedAt, PriceSource source) {
}
