package com.meterpay.pricing;

import com.meterpay.common.NativeUnits;
import com.meterpay.domain.PriceSource;
import com.meterpay.pricing.config.PricingProperties;
import com.meterpay.pricing.source.ReferencePriceSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SOL/USD rate with a short-lived cache. Sources are tried in order; when all fail the last rate is
 * served as stale, and with no rate at all a fixed conservative constant is used. Rate lookup never throws.
 */
@Component
@Slf4j
public class PriceOracle {

    static final int REFERENCE_SCALE = 6;

    private final List<ReferencePriceSource> sources;
    private final PricingProperties properties;
    private final Clock clock;
    private final AtomicReference<RateSnapshot> cached = new AtomicReference<>();

    public PriceOracle(List<ReferencePriceSource> sources, PricingProperties properties, Clock clock) {
        this.sources = List.copyOf(sources);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * SOL needed to pay {@code referenceAmount} USD at the current rate.
     */
    public PriceQuote quote(BigDecimal referenceAmount) {
        requireNonNegative(referenceAmount);
        RateSnapshot snapshot = currentRate();
        BigDecimal nativeAmount = referenceAmount.divide(snapshot.rate(), NativeUnits.NATIVE_SCALE, RoundingMode.HALF_UP);
        return new PriceQuote(referenceAmount, nativeAmount, snapshot.rate(), snapshot.fetchedAt(), snapshot.source());
    }

    /**
     * USD value of {@code nativeAmount} SOL at the current rate.
     */
    public PriceQuote toReference(BigDecimal nativeAmount) {
        requireNonNegative(nativeAmount);
        RateSnapshot snapshot = currentRate();
        BigDecimal referenceAmount = nativeAmount.multiply(snapshot.rate()).setScale(REFERENCE_SCALE, RoundingMode.HALF_UP);
        return new PriceQuote(referenceAmount, nativeAmount, snapshot.rate(), snapshot.fetchedAt(), snapshot.source());
    }

    public RateSnapshot currentRate() {
        RateSnapshot snapshot = cached.get();
        Instant now = clock.instant();
        if (snapshot != null && isFresh(snapshot, now)) {
            return snapshot;
        }
        for (ReferencePriceSource source : sources) {
            Optional<BigDecimal> rate = fetch(source);
            if (rate.isPresent()) {
                RateSnapshot fresh = new RateSnapshot(rate.get(), now, source.source());
                cached.set(fresh);
                return fresh;
            }
        }
        if (snapshot != null) {
            log.warn("All price sources failed; serving stale rate {} from {}", snapshot.rate(), snapshot.fetchedAt());
            return new RateSnapshot(snapshot.rate(), snapshot.fetchedAt(), PriceSource.STALE_CACHE);
        }
        log.warn("All price sources failed and no rate cached; using fallback rate {}", properties.getFallbackRate());
        return new RateSnapshot(properties.getFallbackRate(), now, PriceSource.FIXED_FALLBACK);
    }

    public Optional<RateSnapshot> cachedRate() {
        return Optional.ofNullable(cached.get());
    }

    public void clearCache() {
        cached.set(null);
    }

    boolean isPlausible(BigDecimal rate) {
        return rate != null
                && rate.compareTo(properties.getMinPlausibleRate()) > 0
                && rate.compareTo(properties.getMaxPlausibleRate()) < 0;
    }

    private Optional<BigDecimal> fetch(ReferencePriceSource source) {
        try {
            Optional<BigDecimal> rate = source.fetchRate();
            if (rate.isEmpty()) {
                log.debug("Price source {} returned no rate", source.source());
                return Optional.empty();
            }
            if (!isPlausible(rate.get())) {
                log.warn("Price source {} returned implausible rate {}", source.source(), rate.get());
                return Optional.empty();
            }
            return rate;
        } catch (RuntimeException e) {
            log.warn("Price source {} failed: {}", source.source(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isFresh(RateSnapshot snapshot, Instant now) {
        return Duration.between(snapshot.fetchedAt(), now).toMillis() < properties.getCacheTtlMs();
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
    }
}
