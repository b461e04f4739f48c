package com.meterpay.analytics;

import com.meterpay.domain.DailyUsageStats;
import com.meterpay.domain.DailyUsageStatsRepository;
import com.meterpay.domain.PaymentSession;
import com.meterpay.domain.PaymentSessionRepository;
import com.meterpay.domain.ResourceType;
import com.meterpay.domain.ServiceType;
import com.meterpay.domain.SessionStatus;
import com.meterpay.domain.UsageRecord;
import com.meterpay.domain.UsageRecordRepository;
import com.meterpay.domain.UsageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Rolls usage_records into daily_usage_stats, one row per (UTC day, service type). Rerunning a day
 * overwrites its rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageAggregationService {

    private static final int AMOUNT_SCALE = 6;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final UsageRecordRepository usageRecordRepository;
    private final DailyUsageStatsRepository dailyUsageStatsRepository;
    private final PaymentSessionRepository paymentSessionRepository;
    private final Clock clock;

    @Scheduled(cron = "${meterpay.analytics.daily-cron:0 10 0 * * *}", zone = "UTC")
    public void aggregateYesterday() {
        LocalDate yesterday = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        List<DailyUsageStats> rows = aggregateDay(yesterday);
        log.info("Aggregated usage for {}: {} rows", yesterday, rows.size());
    }

    /**
     * Computes and upserts the stats rows for {@code date}. Service types with no usage get no row.
     */
    public List<DailyUsageStats> aggregateDay(LocalDate date) {
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Map<ServiceType, List<UsageRecord>> byType = new EnumMap<>(ServiceType.class);
        for (UsageRecord record : usageRecordRepository.findCreatedIn(from, to)) {
            ResourceType resourceType = record.getResourceType() != null ? record.getResourceType() : ResourceType.API_CALL;
            byType.computeIfAbsent(resourceType.serviceType(), t -> new ArrayList<>()).add(record);
        }
        Instant now = clock.instant();
        List<DailyUsageStats> rows = new ArrayList<>();
        for (Map.Entry<ServiceType, List<UsageRecord>> entry : byType.entrySet()) {
            DailyUsageStats stats = summarize(entry.getValue());
            stats.setDate(date);
            stats.setServiceType(entry.getKey());
            stats.setUpdatedAt(now);
            rows.add(dailyUsageStatsRepository.upsert(stats));
        }
        return rows;
    }

    public List<DailyUsageStats> dailyStats(LocalDate date) {
        return dailyUsageStatsRepository.findByDate(date);
    }

    /**
     * Daily rows for the last {@code days} days. A null serviceId selects the all-services rows.
     */
    public List<DailyUsageStats> serviceStats(String serviceId, ServiceType serviceType, int days) {
        LocalDate from = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(Math.max(1, days));
        return serviceId == null
                ? dailyUsageStatsRepository.findByServiceTypeAndDateGreaterThanEqualOrderByDateAsc(serviceType, from)
                : dailyUsageStatsRepository.findByServiceIdAndServiceTypeAndDateGreaterThanEqualOrderByDateAsc(
                        serviceId, serviceType, from);
    }

    /**
     * @param payerAddress null for all payers
     */
    public UsageOverview overview(String payerAddress) {
        List<UsageRecord> usage = payerAddress == null
                ? usageRecordRepository.findAll()
                : usageRecordRepository.findByPayerAddress(payerAddress);
        List<PaymentSession> sessions = payerAddress == null
                ? paymentSessionRepository.findAll()
                : paymentSessionRepository.findByPayerAddress(payerAddress);
        long completed = usage.stream().filter(u -> u.getStatus() == UsageStatus.COMPLETED).count();
        BigDecimal revenue = completedVolume(usage);
        long active = sessions.stream().filter(s -> s.getStatus() == SessionStatus.ACTIVE).count();
        BigDecimal authorized = sessions.stream()
                .map(PaymentSession::getAuthorizedAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal averageSessionValue = sessions.isEmpty()
                ? BigDecimal.ZERO
                : authorized.divide(BigDecimal.valueOf(sessions.size()), AMOUNT_SCALE, RoundingMode.HALF_UP);
        return new UsageOverview(payerAddress, revenue, usage.size(), active, averageSessionValue,
                percentage(completed, usage.size()));
    }

    static DailyUsageStats summarize(List<UsageRecord> records) {
        long completed = records.stream().filter(r -> r.getStatus() == UsageStatus.COMPLETED).count();
        BigDecimal volume = completedVolume(records);
        long uniquePayers = records.stream().map(UsageRecord::getPayerAddress).filter(Objects::nonNull).distinct().count();
        OptionalDouble avgResponse = records.stream()
                .map(UsageRecord::getResponseTimeMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average();

        DailyUsageStats stats = new DailyUsageStats();
        stats.setTotalTransactions(records.size());
        stats.setTotalVolume(volume);
        stats.setUniquePayers(uniquePayers);
        stats.setAvgTransactionAmount(completed == 0
                ? BigDecimal.ZERO
                : volume.divide(BigDecimal.valueOf(completed), AMOUNT_SCALE, RoundingMode.HALF_UP));
        stats.setSuccessRate(percentage(completed, records.size()));
        stats.setAvgResponseTimeMs(avgResponse.isPresent() ? Math.round(avgResponse.getAsDouble()) : null);
        return stats;
    }

    private static BigDecimal completedVolume(List<UsageRecord> records) {
        return records.stream()
                .filter(r -> r.getStatus() == UsageStatus.COMPLETED)
                .map(UsageRecord::getAmountCharged)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal percentage(long part, long total) {
        if (total == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
