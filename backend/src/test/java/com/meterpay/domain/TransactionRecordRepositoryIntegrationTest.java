package com.meterpay.domain;

import com.meterpay.config.MongoConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class TransactionRecordRepositoryIntegrationTest {

    private static final String PAYER = "Payer1111111111111111111111111111111111111";
    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    TransactionRecordRepository transactionRecordRepository;
    @Autowired
    UsageRecordRepository usageRecordRepository;

    @BeforeEach
    void clean() {
        transactionRecordRepository.deleteAll();
        usageRecordRepository.deleteAll();
    }

    @Test
    @DisplayName("terminal status is written once: confirm wins, later fail is refused")
    void terminalStatusCompareAndSet() {
        transactionRecordRepository.save(pending("sig-1", T0));

        assertThat(transactionRecordRepository.markConfirmed("sig-1", T0.plusSeconds(3)))
                .hasValueSatisfying(r -> {
                    assertThat(r.getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
                    assertThat(r.getConfirmedAt()).isEqualTo(T0.plusSeconds(3));
                });
        assertThat(transactionRecordRepository.markFailed("sig-1", "late")).isEmpty();
        assertThat(transactionRecordRepository.markConfirmed("sig-1", T0.plusSeconds(9))).isEmpty();

        TransactionRecord stored = transactionRecordRepository.findBySignature("sig-1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
        assertThat(stored.getErrorMessage()).isNull();
        assertThat(stored.getNativeAmount()).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("signatures are unique")
    void uniqueSignature() {
        transactionRecordRepository.save(pending("sig-dup", T0));

        assertThatThrownBy(() -> transactionRecordRepository.insert(pending("sig-dup", T0)))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("reconciliation window and payer history queries")
    void queries() {
        transactionRecordRepository.saveAll(List.of(
                pending("old", T0.minusSeconds(600)),
                pending("fresh", T0.minusSeconds(10))));

        List<TransactionRecord> window = transactionRecordRepository.findByStatusAndCreatedAtBetween(
                TransactionStatus.PENDING, T0.minusSeconds(3600), T0.minusSeconds(60));
        assertThat(window).extracting(TransactionRecord::getSignature).containsExactly("old");

        List<TransactionRecord> history = transactionRecordRepository.findByPayerAddressOrderByCreatedAtDesc(PAYER, PageRequest.of(0, 1));
        assertThat(history).extracting(TransactionRecord::getSignature).containsExactly("fresh");
        assertThat(transactionRecordRepository.countByPayerAddressAndKind(PAYER, TransactionKind.SESSION_OPEN)).isEqualTo(2);
    }

    @Test
    @DisplayName("records with a reserved kind are stored and counted apart")
    void reservedKind() {
        TransactionRecord spend = pending("sig-spend", T0);
        spend.setKind(TransactionKind.CREDIT_SPEND);
        transactionRecordRepository.saveAll(List.of(spend, pending("sig-open", T0)));

        assertThat(transactionRecordRepository.findBySignature("sig-spend").orElseThrow().getKind())
                .isEqualTo(TransactionKind.CREDIT_SPEND);
        assertThat(transactionRecordRepository.countByPayerAddressAndKind(PAYER, TransactionKind.CREDIT_SPEND)).isEqualTo(1);
        assertThat(transactionRecordRepository.countByPayerAddressAndKind(PAYER, TransactionKind.SESSION_USE)).isZero();
    }

    @Test
    @DisplayName("a payment proof can back only one usage record")
    void uniquePaymentProof() {
        usageRecordRepository.insert(usage("proof-1"));
        usageRecordRepository.insert(usage(null));
        usageRecordRepository.insert(usage(null));

        assertThat(usageRecordRepository.existsByPaymentProof("proof-1")).isTrue();
        assertThatThrownBy(() -> usageRecordRepository.insert(usage("proof-1")))
                .isInstanceOf(DuplicateKeyException.class);
        assertThat(usageRecordRepository.findCreatedIn(T0, T0.plusSeconds(1))).hasSize(3);
    }

    private static TransactionRecord pending(String signature, Instant createdAt) {
        TransactionRecord r = new TransactionRecord();
        r.setSignature(signature);
        r.setPayerAddress(PAYER);
        r.setKind(TransactionKind.SESSION_OPEN);
        r.setStatus(TransactionStatus.PENDING);
        r.setNativeAmount(new BigDecimal("0.010000000"));
        r.setReferenceAmount(new BigDecimal("1.00"));
        r.setRate(new BigDecimal("100"));
        r.setPriceSource(PriceSource.PYTH_ONCHAIN);
        r.setCreatedAt(createdAt);
        return r;
    }

    private static UsageRecord usage(String proof) {
        UsageRecord u = new UsageRecord();
        u.setPayerAddress(PAYER);
        u.setResourceType(ResourceType.API_CALL);
        u.setAmountCharged(new BigDecimal("0.25"));
        u.setPaymentProof(proof);
        u.setStatus(UsageStatus.COMPLETED);
        u.setCreatedAt(T0);
        return u;
    }
}
