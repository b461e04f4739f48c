package com.meterpay.pricing.source;

import com.meterpay.domain.PriceSource;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One SOL/USD feed. Sources are consulted in {@link org.springframework.core.annotation.Order} order;
 * implementations may throw or return empty, the oracle treats both as that source failing.
 */
public interface ReferencePriceSource {

    PriceSource source();

    Optional<BigDecimal> fetchRate();
}
