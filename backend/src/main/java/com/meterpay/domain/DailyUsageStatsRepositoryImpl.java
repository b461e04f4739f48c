package com.meterpay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class DailyUsageStatsRepositoryImpl implements DailyUsageStatsRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public DailyUsageStats upsert(DailyUsageStats stats) {
        Query query = new Query(where("date").is(stats.getDate())
                .and("serviceId").is(stats.getServiceId())
                .and("serviceType").is(stats.getServiceType()));
        Update update = new Update()
                .set("totalTransactions", stats.getTotalTransactions())
                .set("totalVolume", stats.getTotalVolume())
                .set("uniquePayers", stats.getUniquePayers())
                .set("avgTransactionAmount", stats.getAvgTransactionAmount())
                .set("successRate", stats.getSuccessRate())
                .set("avgResponseTimeMs", stats.getAvgResponseTimeMs())
                .set("updatedAt", stats.getUpdatedAt());
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), DailyUsageStats.class);
    }
}
