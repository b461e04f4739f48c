package com.meterpay.settlement.monitor;

import com.meterpay.config.AsyncConfig;
import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.ledger.LedgerStatus;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.settlement.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Polls the ledger for submitted signatures until they confirm, fail or time out. One scheduled tick
 * hands due signatures to a fixed worker pool; a signature is never polled by two workers at once.
 * Terminal statuses are written with a compare-and-set from PENDING, so they are written once.
 */
@Component
@Slf4j
public class ConfirmationMonitor {

    private final SettlementLedger settlementLedger;
    private final TransactionRecordRepository transactionRecordRepository;
    private final MonitorProperties properties;
    private final Clock clock;
    private final Executor executor;

    private final Map<String, Tracked> tracked = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ConfirmationMonitor(SettlementLedger settlementLedger,
                               TransactionRecordRepository transactionRecordRepository,
                               MonitorProperties properties,
                               Clock clock,
                               @Qualifier(AsyncConfig.MONITOR_EXECUTOR) Executor executor) {
        this.settlementLedger = settlementLedger;
        this.transactionRecordRepository = transactionRecordRepository;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Starts polling {@code signature} (no-op when already tracked). The first poll is dispatched immediately.
     */
    public void register(String signature) {
        Instant now = clock.instant();
        boolean[] added = {false};
        tracked.computeIfAbsent(signature, s -> {
            added[0] = true;
            return new Tracked(now.plusMillis(properties.getTimeoutMs()), new CompletableFuture<>());
        });
        if (added[0]) {
            log.debug("Tracking {} until confirmation", signature);
            dispatch(signature);
        }
    }

    /**
     * Future completed with the terminal record, or exceptionally with {@link ConfirmationTimeoutException}.
     * Cancelling or timing out the returned future only affects the caller; polling continues.
     */
    public CompletableFuture<TransactionRecord> awaitOutcome(String signature) {
        Tracked t = tracked.get(signature);
        if (t != null) {
            return t.outcome().copy();
        }
        Optional<TransactionRecord> record = transactionRecordRepository.findBySignature(signature);
        if (record.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown transaction " + signature));
        }
        if (record.get().getStatus().isTerminal()) {
            return CompletableFuture.completedFuture(record.get());
        }
        register(signature);
        Tracked registered = tracked.get(signature);
        if (registered == null) {
            return transactionRecordRepository.findBySignature(signature)
                    .map(CompletableFuture::completedFuture)
                    .orElseGet(() -> CompletableFuture.failedFuture(new IllegalArgumentException("Unknown transaction " + signature)));
        }
        return registered.outcome().copy();
    }

    public boolean isTracking(String signature) {
        return tracked.containsKey(signature);
    }

    public int trackedCount() {
        return tracked.size();
    }

    @Scheduled(
            fixedDelayString = "${meterpay.monitor.poll-interval-ms:5000}",
            initialDelayString = "${meterpay.monitor.poll-interval-ms:5000}")
    public void tick() {
        Instant now = clock.instant();
        for (Map.Entry<String, Tracked> entry : tracked.entrySet()) {
            String signature = entry.getKey();
            if (now.isAfter(entry.getValue().deadline())) {
                if (tracked.remove(signature, entry.getValue())) {
                    log.warn("Stopped polling {}: no confirmation before {}; left PENDING", signature, entry.getValue().deadline());
                    entry.getValue().outcome().completeExceptionally(new ConfirmationTimeoutException(signature));
                }
            } else {
                dispatch(signature);
            }
        }
    }

    private void dispatch(String signature) {
        if (!inFlight.add(signature)) {
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    poll(signature);
                } finally {
                    inFlight.remove(signature);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(signature);
            log.warn("Monitor executor rejected poll for {}; retrying next tick", signature);
        }
    }

    void poll(String signature) {
        if (!tracked.containsKey(signature)) {
            return;
        }
        LedgerStatus status;
        try {
            status = settlementLedger.getTransactionStatus(signature);
        } catch (RuntimeException e) {
            log.debug("Status query for {} failed, will retry: {}", signature, e.getMessage());
            return;
        }
        switch (status.state()) {
            case CONFIRMED -> finish(signature,
                    transactionRecordRepository.markConfirmed(signature, clock.instant()));
            case FAILED -> finish(signature,
                    transactionRecordRepository.markFailed(signature, status.error()));
            default -> log.debug("{} is {}", signature, status.state());
        }
    }

    private void finish(String signature, Optional<TransactionRecord> transitioned) {
        Tracked t = tracked.remove(signature);
        TransactionRecord record = transitioned
                .or(() -> transactionRecordRepository.findBySignature(signature))
                .orElse(null);
        if (transitioned.isPresent()) {
            log.info("Transaction {} is {}", signature, transitioned.get().getStatus());
        }
        if (t != null) {
            if (record != null) {
                t.outcome().complete(record);
            } else {
                t.outcome().completeExceptionally(new IllegalStateException("No record for " + signature));
            }
        }
    }

    private record Tracked(Instant deadline, CompletableFuture<TransactionRecord> outcome) {
    }
}
