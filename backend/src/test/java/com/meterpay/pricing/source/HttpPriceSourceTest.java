package com.meterpay.pricing.source;

import com.meterpay.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPriceSourceTest {

    private final PricingProperties properties = new PricingProperties();

    @Test
    @DisplayName("CoinGecko parses solana.usd")
    void coinGeckoParse() {
        CoinGeckoPriceSource source = new CoinGeckoPriceSource(WebClient.builder(), limiter(10), properties);
        assertThat(source.parse("{\"solana\":{\"usd\":142.5}}")).hasValueSatisfying(
                rate -> assertThat(rate).isEqualByComparingTo("142.5"));
        assertThat(source.parse("{\"bitcoin\":{\"usd\":1}}")).isEmpty();
        assertThat(source.parse("not json")).isEmpty();
        assertThat(source.parse("")).isEmpty();
    }

    @Test
    @DisplayName("Coinbase parses the string-valued USD rate")
    void coinbaseParse() {
        CoinbasePriceSource source = new CoinbasePriceSource(WebClient.builder(), limiter(10), properties);
        assertThat(source.parse("{\"data\":{\"currency\":\"SOL\",\"rates\":{\"USD\":\"142.51\"}}}")).hasValueSatisfying(
                rate -> assertThat(rate).isEqualByComparingTo("142.51"));
        assertThat(source.parse("{\"data\":{\"rates\":{\"USD\":\"n/a\"}}}")).isEmpty();
    }

    @Test
    @DisplayName("fetchRate calls the feed over HTTP")
    void fetchRateOverHttp() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header("Content-Type", "application/json")
                        .body("{\"solana\": {\"usd\": 151.02}}")
                        .build()));
        CoinGeckoPriceSource source = new CoinGeckoPriceSource(builder, limiter(10), properties);

        assertThat(source.fetchRate()).hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("151.02"));
    }

    @Test
    @DisplayName("an HTTP error status yields empty")
    void httpErrorYieldsEmpty() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build()));
        CoinbasePriceSource source = new CoinbasePriceSource(builder, limiter(10), properties);

        assertThat(source.fetchRate()).isEmpty();
    }

    @Test
    @DisplayName("the shared rate limiter skips calls once the budget is spent")
    void rateLimited() {
        AtomicInteger requests = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> {
                    requests.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header("Content-Type", "application/json")
                            .body("{\"solana\": {\"usd\": 151.02}}")
                            .build());
                });
        CoinGeckoPriceSource source = new CoinGeckoPriceSource(builder, limiter(1), properties);

        assertThat(source.fetchRate()).isPresent();
        assertThat(source.fetchRate()).isEmpty();
        assertThat(requests.get()).isEqualTo(1);
    }

    private static RateLimiter limiter(int perMinute) {
        return RateLimiter.of("test-price-feed", RateLimiterConfig.custom()
                .limitForPeriod(perMinute)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
    }
}
