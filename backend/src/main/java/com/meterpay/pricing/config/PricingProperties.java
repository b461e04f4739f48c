package com.meterpay.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * SOL/USD oracle configuration under meterpay.pricing.
 */
@ConfigurationProperties(prefix = "meterpay.pricing")
@Getter
@Setter
public class PricingProperties {

    /** How long a fetched rate is served without asking any source again. */
    private long cacheTtlMs = 30_000;

    /** Rate used when no source ever answered. */
    private BigDecimal fallbackRate = new BigDecimal("150");

    /** Rates at or below this are rejected. */
    private BigDecimal minPlausibleRate = BigDecimal.ZERO;

    /** Rates at or above this are rejected. */
    private BigDecimal maxPlausibleRate = new BigDecimal("10000");

    /** Pyth SOL/USD price account. */
    private String pythPriceAccount = "H6ARHf6YXhGYeQfUzQNGk6rDNnLBQKrenN712K4AQJEG";

    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    private String coinbaseBaseUrl = "https://api.coinbase.com/v2";

    /** Shared budget for off-chain price HTTP calls. */
    private int httpRequestsPerMinute = 30;

    private long httpTimeoutMs = 5_000;
}
