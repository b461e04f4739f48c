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
 * CoinGecko /simple/price: {"solana":{"usd":142.5}}.
 */
@Component
@Order(1)
public class CoinGeckoPriceSource extends HttpPriceSource {

    private final String baseUrl;

    public CoinGeckoPriceSource(WebClient.Builder webClientBuilder,
                                @Qualifier(PricingConfig.PRICE_FEED_RATE_LIMITER) RateLimiter rateLimiter,
                                PricingProperties pricingProperties) {
        super(webClientBuilder, rateLimiter, pricingProperties);
        this.baseUrl = pricingProperties.getCoingeckoBaseUrl();
    }

    @Override
    public PriceSource source() {
        return PriceSource.COINGECKO;
    }

    @Override
    protected String url() {
        return baseUrl + "/simple/price?ids=solana&vs_currencies=usd";
    }

    @Override
    protected JsonNode priceNode(JsonNode root) {
        return root.path("solana").path("usd");
    }
}
