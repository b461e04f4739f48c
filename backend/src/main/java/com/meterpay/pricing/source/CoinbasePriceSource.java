package com.meterpay.pricing.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.meterpay.domain.PriceSource;
import com.meterpay.pricing.config.PricingConfig;
import com.meterpay.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Coinbase /exchange-rates?currency=SOL: {"data":{"currency":"SOL","rates":{"USD":"142.51"}}}.
 */
@Component
@Order(2)
public class CoinbasePriceSource extends HttpPriceSource {

    private final String baseUrl;

    public CoinbasePriceSource(WebClient.Builder webClientBuilder,
                               @Qualifier(PricingConfig.PRICE_FEED_RATE_LIMITER) RateLimiter rateLimiter,
                               PricingProperties pricingProperties) {
        super(webClientBuilder, rateLimiter, pricingProperties);
        this.baseUrl = pricingProperties.getCoinbaseBaseUrl();
    }

    @Override
    public PriceSource source() {
        return PriceSource.COINBASE;
    }

    @Override
    protected String url() {
        return baseUrl + "/exchange-rates?currency=SOL";
    }

    @Override
    protected JsonNode priceNode(JsonNode root) {
        return root.path("data").path("rates").path("USD");
    }
}
