package com.meterpay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class PaymentSessionRepositoryImpl implements PaymentSessionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PaymentSession> debit(String token, BigDecimal amount, Instant now) {
        Query query = new Query(where("token").is(token)
                .and("status").is(SessionStatus.ACTIVE)
                .and("expiresAt").gte(now)
                .and("remainingAmount").gte(amount));
        Update update = new Update()
                .inc("spentAmount", amount)
                .inc("remainingAmount", amount.negate())
                .set("lastUsedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), PaymentSession.class));
    }

    @Override
    public boolean markDepletedIfExhausted(String token) {
        Query query = new Query(where("token").is(token)
                .and("status").is(SessionStatus.ACTIVE)
                .and("remainingAmount").lte(BigDecimal.ZERO));
        Update update = new Update().set("status", SessionStatus.DEPLETED);
        return mongoTemplate.updateFirst(query, update, PaymentSession.class).getModifiedCount() > 0;
    }

    @Override
    public boolean transition(String token, SessionStatus from, SessionStatus to) {
        Query query = new Query(where("token").is(token).and("status").is(from));
        Update update = new Update().set("status", to);
        return mongoTemplate.updateFirst(query, update, PaymentSession.class).getModifiedCount() > 0;
    }

    @Override
    public long expireOverdue(Instant now) {
        Query query = new Query(where("status").is(SessionStatus.ACTIVE).and("expiresAt").lt(now));
        Update update = new Update().set("status", SessionStatus.EXPIRED);
        return mongoTemplate.updateMulti(query, update, PaymentSession.class).getModifiedCount();
    }
}
