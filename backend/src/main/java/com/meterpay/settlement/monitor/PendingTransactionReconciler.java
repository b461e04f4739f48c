package com.meterpay.settlement.monitor;

import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.domain.TransactionStatus;
import com.meterpay.settlement.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Re-registers PENDING records older than the grace period with the {@link ConfirmationMonitor}, at startup
 * and periodically. Covers a restart between submission and confirmation and polls that timed out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingTransactionReconciler {

    private final TransactionRecordRepository transactionRecordRepository;
    private final ConfirmationMonitor confirmationMonitor;
    private final MonitorProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int count = reconcile();
        if (count > 0) {
            log.info("Startup reconciliation re-registered {} pending transactions", count);
        }
    }

    @Scheduled(
            fixedDelayString = "${meterpay.monitor.reconcile-interval-ms:60000}",
            initialDelayString = "${meterpay.monitor.reconcile-interval-ms:60000}")
    public void runScheduled() {
        reconcile();
    }

    /**
     * @return number of signatures newly handed to the monitor
     */
    public int reconcile() {
        Instant now = clock.instant();
        Instant graceCutoff = now.minusMillis(properties.getReconcileGraceMs());
        Instant oldest = now.minusMillis(properties.getReconcileMaxAgeMs());
        List<TransactionRecord> pending = transactionRecordRepository
                .findByStatusAndCreatedAtBetween(TransactionStatus.PENDING, oldest, graceCutoff);
        int registered = 0;
        for (TransactionRecord record : pending) {
            if (!confirmationMonitor.isTracking(record.getSignature())) {
                confirmationMonitor.register(record.getSignature());
                registered++;
            }
        }
        if (registered > 0) {
            log.debug("Reconciliation re-registered {} of {} pending transactions", registered, pending.size());
        }
        return registered;
    }
}
