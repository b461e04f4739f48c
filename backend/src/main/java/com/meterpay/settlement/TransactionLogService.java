package com.meterpay.settlement;

import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.domain.TransactionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read side of transaction_logs: lookups, payer history and statistics. Volumes count CONFIRMED records only.
 */
@Service
@RequiredArgsConstructor
public class TransactionLogService {

    static final int MAX_HISTORY = 500;

    private final TransactionRecordRepository transactionRecordRepository;

    public Optional<TransactionRecord> find(String signature) {
        return transactionRecordRepository.findBySignature(signature);
    }

    public List<TransactionRecord> history(String payerAddress, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return transactionRecordRepository.findByPayerAddressOrderByCreatedAtDesc(payerAddress, PageRequest.of(0, size));
    }

    /**
     * @param payerAddress null for all payers
     */
    public TransactionStats stats(String payerAddress) {
        List<TransactionRecord> records = payerAddress == null
                ? transactionRecordRepository.findAll()
                : transactionRecordRepository.findByPayerAddress(payerAddress);
        long confirmed = count(records, TransactionStatus.CONFIRMED);
        long failed = count(records, TransactionStatus.FAILED);
        long pending = count(records, TransactionStatus.PENDING);
        BigDecimal nativeVolume = BigDecimal.ZERO;
        BigDecimal referenceVolume = BigDecimal.ZERO;
        for (TransactionRecord r : records) {
            if (r.getStatus() == TransactionStatus.CONFIRMED) {
                nativeVolume = nativeVolume.add(orZero(r.getNativeAmount()));
                referenceVolume = referenceVolume.add(orZero(r.getReferenceAmount()));
            }
        }
        OptionalDouble avgSeconds = records.stream()
                .filter(r -> r.getStatus() == TransactionStatus.CONFIRMED && r.getConfirmedAt() != null && r.getCreatedAt() != null)
                .mapToLong(r -> Duration.between(r.getCreatedAt(), r.getConfirmedAt()).toMillis())
                .average();
        return new TransactionStats(records.size(), confirmed, failed, pending, nativeVolume, referenceVolume,
                avgSeconds.isPresent() ? avgSeconds.getAsDouble() / 1000.0 : null);
    }

    private static long count(List<TransactionRecord> records, TransactionStatus status) {
        return records.stream().filter(r -> r.getStatus() == status).count();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
