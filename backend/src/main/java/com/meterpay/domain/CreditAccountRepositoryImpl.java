package com.meterpay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class CreditAccountRepositoryImpl implements CreditAccountRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public CreditAccount credit(String payerAddress, String serviceId, ServiceType serviceType,
                                BigDecimal amount, String topupSignature, Instant now) {
        Query query = new Query(accountKey(payerAddress, serviceId, serviceType));
        Update update = new Update()
                .inc("balance", amount)
                .inc("totalPurchased", amount)
                .setOnInsert("totalSpent", BigDecimal.ZERO)
                .setOnInsert("autoTopupEnabled", false)
                .setOnInsert("createdAt", now)
                .set("lastTopupSignature", topupSignature)
                .set("lastTopupAmount", amount)
                .set("lastTopupAt", now)
                .set("updatedAt", now);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), CreditAccount.class);
    }

    @Override
    public Optional<CreditAccount> debit(String payerAddress, String serviceId, ServiceType serviceType,
                                         BigDecimal amount, Instant now) {
        Query query = new Query(accountKey(payerAddress, serviceId, serviceType).and("balance").gte(amount));
        Update update = new Update()
                .inc("balance", amount.negate())
                .inc("totalSpent", amount)
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), CreditAccount.class));
    }

    @Override
    public Optional<CreditAccount> updateAutoTopup(String payerAddress, String serviceId, ServiceType serviceType,
                                                   boolean enabled, BigDecimal threshold, BigDecimal amount,
                                                   Instant now) {
        Update update = new Update()
                .set("autoTopupEnabled", enabled)
                .set("autoTopupThreshold", threshold)
                .set("autoTopupAmount", amount)
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                new Query(accountKey(payerAddress, serviceId, serviceType)), update,
                FindAndModifyOptions.options().returnNew(true), CreditAccount.class));
    }

    private static Criteria accountKey(String payerAddress, String serviceId, ServiceType serviceType) {
        return where("payerAddress").is(payerAddress)
                .and("serviceId").is(serviceId)
                .and("serviceType").is(serviceType);
    }
}
