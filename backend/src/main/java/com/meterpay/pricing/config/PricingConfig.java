package com.meterpay.pricing.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pricing module configuration: properties and the rate limiter shared by off-chain price feeds.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String PRICE_FEED_RATE_LIMITER = "priceFeedRateLimiter";

    /** Non-blocking: a call over budget is refused immediately and that feed counts as failed. */
    @Bean(name = PRICE_FEED_RATE_LIMITER)
    public RateLimiter priceFeedRateLimiter(PricingProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getHttpRequestsPerMinute()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("price-feed", config);
    }
}
