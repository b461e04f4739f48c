package com.meterpay.ledger.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC transport. Returns the raw response body; failover is the caller's concern.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
