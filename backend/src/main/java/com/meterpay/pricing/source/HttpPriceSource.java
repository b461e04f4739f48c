package com.meterpay.pricing.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterpay.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Off-chain JSON price feed fetched with WebClient under the shared price-feed rate limiter.
 * Responses are untrusted: anything that does not parse to a number yields empty.
 */
@Slf4j
public abstract class HttpPriceSource implements ReferencePriceSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    protected HttpPriceSource(WebClient.Builder webClientBuilder, RateLimiter rateLimiter,
                              PricingProperties pricingProperties) {
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.timeout = Duration.ofMillis(pricingProperties.getHttpTimeoutMs());
    }

    protected abstract String url();

    /** Extracts USD per SOL from the parsed body. */
    protected abstract JsonNode priceNode(JsonNode root);

    @Override
    public Optional<BigDecimal> fetchRate() {
        if (!rateLimiter.acquirePermission()) {
            log.debug("Price feed {} skipped: local rate limit reached", source());
            return Optional.empty();
        }
        try {
            String body = webClientBuilder.build()
                    .get()
                    .uri(url())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return parse(body);
        } catch (WebClientResponseException e) {
            log.warn("Price feed {} returned {}: {}", source(), e.getStatusCode(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<BigDecimal> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = priceNode(MAPPER.readTree(json));
            if (node == null || node.isMissingNode() || node.isNull()) {
                return Optional.empty();
            }
            if (node.isNumber()) {
                return Optional.of(node.decimalValue());
            }
            if (node.isTextual()) {
                return Optional.of(new BigDecimal(node.asText().trim()));
            }
            return Optional.empty();
        } catch (Exception e) {
            log.debug("Price feed {} body not parseable: {}", source(), e.getMessage());
            return Optional.empty();
        }
    }
}
