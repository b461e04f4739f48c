package com.meterpay.domain;

/**
 * Provenance of the SOL/USD rate used for a quote.
 */
public enum PriceSource {
    /** Pyth price account read through the RPC pool. */
    PYTH_ONCHAIN,
    COINGECKO,
    COINBASE,
    /** Last known rate served past its TTL because every live source failed. */
    STALE_CACHE,
    /** Conservative constant used when no rate was ever obtained. */
    FIXED_FALLBACK
}
