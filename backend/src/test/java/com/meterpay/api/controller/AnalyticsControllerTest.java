package com.meterpay.api.controller;

import com.meterpay.analytics.UsageAggregationService;
import com.meterpay.analytics.UsageOverview;
import com.meterpay.domain.DailyUsageStats;
import com.meterpay.domain.ServiceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = AnalyticsController.class)
class AnalyticsControllerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    UsageAggregationService usageAggregationService;

    @Test
    @DisplayName("POST /analytics/daily/{date} runs the aggregation and answers 202")
    void aggregate() {
        when(usageAggregationService.aggregateDay(DAY)).thenReturn(List.of(stats()));

        webTestClient.post().uri("/api/v1/analytics/daily/2025-03-01")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$[0].serviceType").isEqualTo("API")
                .jsonPath("$[0].totalTransactions").isEqualTo(4);
    }

    @Test
    @DisplayName("overview is returned for one wallet")
    void overview() {
        when(usageAggregationService.overview("w")).thenReturn(new UsageOverview("w", new BigDecimal("2.50"), 10L, 1L,
                new BigDecimal("10.00"), new BigDecimal("90.00")));

        webTestClient.get().uri("/api/v1/analytics/overview?wallet=w")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalRevenue").isEqualTo(2.5)
                .jsonPath("$.activeSessions").isEqualTo(1);
    }

    @Test
    @DisplayName("unknown service type is rejected")
    void unknownServiceType() {
        webTestClient.get().uri("/api/v1/analytics/services/mainframe")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_SERVICE_TYPE");
        verifyNoInteractions(usageAggregationService);
    }

    private static DailyUsageStats stats() {
        DailyUsageStats s = new DailyUsageStats();
        s.setDate(DAY);
        s.setServiceType(ServiceType.API);
        s.setTotalTransactions(4);
        s.setTotalVolume(new BigDecimal("1.00"));
        return s;
    }
}
