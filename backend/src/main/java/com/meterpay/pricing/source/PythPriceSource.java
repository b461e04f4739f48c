package com.meterpay.pricing.source;

import com.meterpay.domain.PriceSource;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Primary feed: the Pyth SOL/USD account, read through the RPC failover pool.
 */
@Component
@Order(0)
@RequiredArgsConstructor
public class PythPriceSource implements ReferencePriceSource {

    private final SettlementLedger settlementLedger;
    private final PricingProperties pricingProperties;

    @Override
    public PriceSource source() {
        return PriceSource.PYTH_ONCHAIN;
    }

    @Override
    public Optional<BigDecimal> fetchRate() {
        return settlementLedger.getLatestReferencePrice(pricingProperties.getPythPriceAccount());
    }
}
