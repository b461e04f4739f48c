package com.meterpay.api.controller;

import com.meterpay.domain.ServiceType;
import com.meterpay.ledger.EndpointPoolExhaustedException;
import com.meterpay.ledger.RpcException;
import com.meterpay.protocol.AccessGrant;
import com.meterpay.protocol.InvalidPaymentHeaderException;
import com.meterpay.protocol.PaymentGate;
import com.meterpay.protocol.PaymentGateException;
import com.meterpay.protocol.PaymentRequiredException;
import com.meterpay.session.SessionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = MeteredAccessController.class)
class MeteredAccessControllerTest {

    private static final String PAYER = "Payer1111111111111111111111111111111111111";
    private static final String URL = "/api/v1/metered/api/weather-svc/access?resource=api/weather-svc/today";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    PaymentGate paymentGate;

    @Test
    @DisplayName("missing header answers 402 with the required amount")
    void paymentRequired() {
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), eq("api/weather-svc/today"), eq("GET"), isNull()))
                .thenThrow(new PaymentRequiredException(new BigDecimal("0.25"), "USDC",
                        "Owner1111111111111111111111111111111111111", "api/weather-svc/*"));

        webTestClient.post().uri(URL)
                .exchange()
                .expectStatus().isEqualTo(402)
                .expectHeader().valueEquals("X-402-Required-Amount", "0.25")
                .expectBody()
                .jsonPath("$.error").isEqualTo("PAYMENT_REQUIRED")
                .jsonPath("$.amount").isEqualTo(0.25)
                .jsonPath("$.currency").isEqualTo("USDC")
                .jsonPath("$.header").isEqualTo("X-402-Payment");
    }

    @Test
    @DisplayName("a session header is charged and the remaining balance returned")
    void sessionGranted() {
        String header = "session=tok; wallet=" + PAYER;
        when(paymentGate.authorize("weather-svc", ServiceType.API, "api/weather-svc/today", "GET", header))
                .thenReturn(new AccessGrant(AccessGrant.Mode.SESSION, new BigDecimal("0.25"), new BigDecimal("9.75"), "tok"));

        webTestClient.post().uri(URL)
                .header("X-402-Payment", header)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.granted").isEqualTo(true)
                .jsonPath("$.mode").isEqualTo("SESSION")
                .jsonPath("$.remainingBalance").isEqualTo(9.75);
    }

    @Test
    @DisplayName("domain refusals map to their HTTP statuses")
    void refusals() {
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), any(), any(), eq("session=gone; wallet=" + PAYER)))
                .thenThrow(new SessionException(SessionException.Code.SESSION_EXPIRED, "Session has expired"));
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), any(), any(), eq("proof=used; wallet=" + PAYER)))
                .thenThrow(new PaymentGateException(PaymentGateException.Code.PROOF_REUSED, "Payment proof was already used"));
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), any(), any(), eq("garbage")))
                .thenThrow(new InvalidPaymentHeaderException("Malformed payment header field: garbage"));

        webTestClient.post().uri(URL).header("X-402-Payment", "session=gone; wallet=" + PAYER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("SESSION_EXPIRED");
        webTestClient.post().uri(URL).header("X-402-Payment", "proof=used; wallet=" + PAYER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("PROOF_REUSED");
        webTestClient.post().uri(URL).header("X-402-Payment", "garbage")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_PAYMENT_HEADER");
    }

    @Test
    @DisplayName("settlement network failures answer 503 NETWORK_UNAVAILABLE")
    void networkUnavailable() {
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), any(), any(), eq("proof=down; wallet=" + PAYER)))
                .thenThrow(new EndpointPoolExhaustedException("getTransaction",
                        List.of(new RpcException("503 from primary"), new RpcException("timeout from backup"))));
        when(paymentGate.authorize(eq("weather-svc"), eq(ServiceType.API), any(), any(), eq("proof=stray; wallet=" + PAYER)))
                .thenThrow(new RpcException("connection reset"));

        webTestClient.post().uri(URL).header("X-402-Payment", "proof=down; wallet=" + PAYER)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody().jsonPath("$.error").isEqualTo("NETWORK_UNAVAILABLE");
        webTestClient.post().uri(URL).header("X-402-Payment", "proof=stray; wallet=" + PAYER)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody().jsonPath("$.error").isEqualTo("NETWORK_UNAVAILABLE");
    }

    @Test
    @DisplayName("an unknown service type is rejected before the gate")
    void unknownServiceType() {
        webTestClient.post().uri("/api/v1/metered/blockchain/x/access")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_SERVICE_TYPE");
        verifyNoInteractions(paymentGate);
    }
}
