package com.meterpay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed status transitions; the PENDING filter makes terminal writes happen at most once.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRecordRepositoryImpl implements TransactionRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<TransactionRecord> markConfirmed(String signature, Instant confirmedAt) {
        Update update = new Update()
                .set("status", TransactionStatus.CONFIRMED)
                .set("confirmedAt", confirmedAt);
        return transitionFromPending(signature, update);
    }

    @Override
    public Optional<TransactionRecord> markFailed(String signature, String errorMessage) {
        Update update = new Update()
                .set("status", TransactionStatus.FAILED)
                .set("errorMessage", errorMessage);
        return transitionFromPending(signature, update);
    }

    private Optional<TransactionRecord> transitionFromPending(String signature, Update update) {
        Query query = new Query(where("signature").is(signature).and("status").is(TransactionStatus.PENDING));
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), TransactionRecord.class));
    }
}
