package com.meterpay.ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settlement network RPC configuration under meterpay.ledger.
 */
@ConfigurationProperties(prefix = "meterpay.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Ordered RPC endpoints; the first is preferred at startup. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://api.mainnet-beta.solana.com"));

    /** Commitment level for reads and preflight. */
    private String commitment = "confirmed";

    /** Per-request timeout in milliseconds. */
    private long requestTimeoutMs = 10_000;

    private Retry retry = new Retry();

    public void setRpcUrls(List<String> rpcUrls) {
        this.rpcUrls = rpcUrls != null ? rpcUrls : new ArrayList<>();
    }

    /**
     * Backoff between failover attempts within one operation.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 250;
        private double jitterFactor = 0.2;
        private long maxDelayMs = 2_000;
    }
}
