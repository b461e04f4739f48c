package com.meterpay.settlement.monitor;

import com.meterpay.common.MutableClock;
import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.domain.TransactionStatus;
import com.meterpay.ledger.LedgerStatus;
import com.meterpay.ledger.RpcException;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.settlement.config.MonitorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfirmationMonitorTest {

    private static final String SIG = "sig-1";
    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    SettlementLedger settlementLedger;
    @Mock
    TransactionRecordRepository transactionRecordRepository;

    private MutableClock clock;
    private ConfirmationMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        monitor = new ConfirmationMonitor(settlementLedger, transactionRecordRepository,
                new MonitorProperties(), clock, Runnable::run);
    }

    @Test
    @DisplayName("a confirmed signature is marked CONFIRMED once and the waiter is completed")
    void confirms() throws Exception {
        when(settlementLedger.getTransactionStatus(SIG))
                .thenReturn(LedgerStatus.pending())
                .thenReturn(LedgerStatus.confirmed());
        TransactionRecord confirmed = record(TransactionStatus.CONFIRMED);
        when(transactionRecordRepository.markConfirmed(SIG, START)).thenReturn(Optional.of(confirmed));

        monitor.register(SIG);
        CompletableFuture<TransactionRecord> outcome = monitor.awaitOutcome(SIG);
        assertThat(outcome).isNotDone();

        monitor.tick();

        assertThat(outcome.get().getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
        assertThat(monitor.isTracking(SIG)).isFalse();
        verify(transactionRecordRepository, times(1)).markConfirmed(SIG, START);
    }

    @Test
    @DisplayName("a ledger error marks the record FAILED with the error text")
    void fails() throws Exception {
        when(settlementLedger.getTransactionStatus(SIG)).thenReturn(LedgerStatus.failed("{\"InstructionError\":[0,\"Custom\"]}"));
        TransactionRecord failed = record(TransactionStatus.FAILED);
        when(transactionRecordRepository.markFailed(SIG, "{\"InstructionError\":[0,\"Custom\"]}")).thenReturn(Optional.of(failed));

        monitor.register(SIG);

        assertThat(monitor.isTracking(SIG)).isFalse();
        verify(transactionRecordRepository, never()).markConfirmed(anyString(), any());
    }

    @Test
    @DisplayName("status query errors are transient and polling continues")
    void transientErrorsKeepPolling() {
        when(settlementLedger.getTransactionStatus(SIG))
                .thenThrow(new RpcException("timeout"))
                .thenReturn(LedgerStatus.notFound())
                .thenReturn(LedgerStatus.confirmed());
        when(transactionRecordRepository.markConfirmed(SIG, START)).thenReturn(Optional.of(record(TransactionStatus.CONFIRMED)));

        monitor.register(SIG);
        assertThat(monitor.isTracking(SIG)).isTrue();
        monitor.tick();
        assertThat(monitor.isTracking(SIG)).isTrue();
        monitor.tick();

        assertThat(monitor.isTracking(SIG)).isFalse();
    }

    @Test
    @DisplayName("polling stops at the timeout, the waiter fails and the record is left PENDING")
    void timesOut() {
        when(settlementLedger.getTransactionStatus(SIG)).thenReturn(LedgerStatus.pending());

        monitor.register(SIG);
        CompletableFuture<TransactionRecord> outcome = monitor.awaitOutcome(SIG);
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        monitor.tick();

        assertThat(monitor.isTracking(SIG)).isFalse();
        assertThatThrownBy(outcome::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ConfirmationTimeoutException.class);
        verify(transactionRecordRepository, never()).markConfirmed(anyString(), any());
        verify(transactionRecordRepository, never()).markFailed(anyString(), anyString());
    }

    @Test
    @DisplayName("registering a tracked signature twice polls it once")
    void registerIsIdempotent() {
        when(settlementLedger.getTransactionStatus(SIG)).thenReturn(LedgerStatus.pending());

        monitor.register(SIG);
        monitor.register(SIG);

        assertThat(monitor.trackedCount()).isEqualTo(1);
        verify(settlementLedger, times(1)).getTransactionStatus(SIG);
    }

    @Test
    @DisplayName("losing the terminal write completes the waiter with the stored record")
    void lostCompareAndSet() throws Exception {
        when(settlementLedger.getTransactionStatus(SIG)).thenReturn(LedgerStatus.pending(), LedgerStatus.confirmed());
        when(transactionRecordRepository.markConfirmed(SIG, START)).thenReturn(Optional.empty());
        when(transactionRecordRepository.findBySignature(SIG)).thenReturn(Optional.of(record(TransactionStatus.CONFIRMED)));

        monitor.register(SIG);
        CompletableFuture<TransactionRecord> outcome = monitor.awaitOutcome(SIG);
        monitor.tick();

        assertThat(outcome.get().getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
    }

    @Test
    @DisplayName("awaitOutcome answers terminal records directly and fails for unknown signatures")
    void awaitOutcomeUntracked() throws Exception {
        when(transactionRecordRepository.findBySignature(SIG)).thenReturn(Optional.of(record(TransactionStatus.FAILED)));
        assertThat(monitor.awaitOutcome(SIG).get().getStatus()).isEqualTo(TransactionStatus.FAILED);

        when(transactionRecordRepository.findBySignature("missing")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> monitor.awaitOutcome("missing").get())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(settlementLedger);
    }

    @Test
    @DisplayName("cancelling a waiter does not stop polling")
    void cancelDoesNotStopPolling() {
        when(settlementLedger.getTransactionStatus(SIG)).thenReturn(LedgerStatus.pending());

        monitor.register(SIG);
        monitor.awaitOutcome(SIG).cancel(true);
        monitor.tick();

        assertThat(monitor.isTracking(SIG)).isTrue();
        verify(settlementLedger, times(2)).getTransactionStatus(SIG);
    }

    private static TransactionRecord record(TransactionStatus status) {
        TransactionRecord record = new TransactionRecord();
        record.setSignature(SIG);
        record.setStatus(status);
        record.setCreatedAt(START);
        return record;
    }
}
