package com.meterpay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;

public interface DailyUsageStatsRepository
        extends MongoRepository<DailyUsageStats, String>, DailyUsageStatsRepositoryCustom {

    List<DailyUsageStats> findByDate(LocalDate date);

    List<DailyUsageStats> findByServiceIdAndServiceTypeAndDateGreaterThanEqualOrderByDateAsc(
            String serviceId, ServiceType serviceType, LocalDate from);

    List<DailyUsageStats> findByServiceTypeAndDateGreaterThanEqualOrderByDateAsc(ServiceType serviceType, LocalDate from);
}
