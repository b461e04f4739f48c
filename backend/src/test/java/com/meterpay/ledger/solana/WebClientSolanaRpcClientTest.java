package com.meterpay.ledger.solana;

import com.meterpay.ledger.RpcException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

class WebClientSolanaRpcClientTest {

    @Test
    @DisplayName("returns the raw JSON-RPC body on 200")
    void returnsBody() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header("Content-Type", "application/json")
                        .body("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":42}}")
                        .build()));
        WebClientSolanaRpcClient client = new WebClientSolanaRpcClient(builder, Duration.ofSeconds(2));

        StepVerifier.create(client.call("https://rpc.test", "getBalance", List.of("addr")))
                .expectNext("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":42}}")
                .verifyComplete();
    }

    @Test
    @DisplayName("maps HTTP error statuses to RpcException")
    void httpErrorMapsToRpcException() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build()));
        WebClientSolanaRpcClient client = new WebClientSolanaRpcClient(builder, Duration.ofSeconds(2));

        StepVerifier.create(client.call("https://rpc.test", "getBalance", List.of("addr")))
                .expectError(RpcException.class)
                .verify();
    }

    @Test
    @DisplayName("maps a response slower than the timeout to RpcException")
    void timeoutMapsToRpcException() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.<ClientResponse>never());
        WebClientSolanaRpcClient client = new WebClientSolanaRpcClient(builder, Duration.ofMillis(50));

        StepVerifier.create(client.call("https://rpc.test", "getLatestBlockhash", null))
                .expectError(RpcException.class)
                .verify(Duration.ofSeconds(5));
    }
}
