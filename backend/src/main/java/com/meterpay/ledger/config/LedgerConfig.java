package com.meterpay.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterpay.common.RetryPolicy;
import com.meterpay.ledger.EndpointFailoverPool;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.ledger.solana.SolanaRpcClient;
import com.meterpay.ledger.solana.SolanaSettlementLedger;
import com.meterpay.ledger.solana.WebClientSolanaRpcClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the RPC failover pool and the Solana-backed {@link SettlementLedger}.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    @Bean
    public EndpointFailoverPool endpointFailoverPool(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        return new EndpointFailoverPool(properties.getRpcUrls(),
                new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxDelayMs()));
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, LedgerProperties properties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public SettlementLedger settlementLedger(SolanaRpcClient solanaRpcClient,
                                             EndpointFailoverPool endpointFailoverPool,
                                             ObjectMapper objectMapper,
                                             LedgerProperties properties) {
        return new SolanaSettlementLedger(solanaRpcClient, endpointFailoverPool, objectMapper, properties.getCommitment());
    }
}
