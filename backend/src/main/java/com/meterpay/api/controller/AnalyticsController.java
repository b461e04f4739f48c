package com.meterpay.api.controller;

import com.meterpay.analytics.UsageAggregationService;
import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.validation.ServiceTypes;
import com.meterpay.domain.DailyUsageStats;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily usage statistics and the on-demand aggregation trigger.
 */
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final UsageAggregationService usageAggregationService;

    @GetMapping("/daily")
    public ResponseEntity<List<DailyUsageStats>> daily(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(usageAggregationService.dailyStats(date));
    }

    @PostMapping("/daily/{date}")
    public ResponseEntity<List<DailyUsageStats>> aggregate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.accepted().body(usageAggregationService.aggregateDay(date));
    }

    @GetMapping("/services/{serviceType}")
    public ResponseEntity<?> serviceStats(@PathVariable String serviceType,
                                          @RequestParam(required = false) String serviceId,
                                          @RequestParam(defaultValue = "30") int days) {
        return ServiceTypes.parse(serviceType)
                .<ResponseEntity<?>>map(type -> ResponseEntity.ok(usageAggregationService.serviceStats(serviceId, type, days)))
                .orElseGet(() -> ResponseEntity.badRequest().body(ErrorBody.of("INVALID_SERVICE_TYPE", "Unknown service type")));
    }

    @GetMapping("/overview")
    public ResponseEntity<?> overview(@RequestParam(required = false) String wallet) {
        return ResponseEntity.ok(usageAggregationService.overview(wallet));
    }
}
