package com.meterpay.session;

import com.meterpay.domain.PaymentSession;
import com.meterpay.domain.PaymentSessionRepository;
import com.meterpay.domain.ResourceType;
import com.meterpay.domain.SessionStatus;
import com.meterpay.domain.TransactionKind;
import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.UsageRecord;
import com.meterpay.domain.UsageRecordRepository;
import com.meterpay.domain.UsageStatus;
import com.meterpay.settlement.submit.PaymentFailedException;
import com.meterpay.settlement.submit.TransactionSubmitter;
import com.meterpay.settlement.submit.TransferSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Opens payment sessions against an upfront payment and draws them down per metered use.
 * Spends are single conditional updates in the store, so concurrent spends on one token serialize
 * and a spend larger than the remaining amount changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSessionService {

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final TransactionSubmitter transactionSubmitter;
    private final PaymentSessionRepository paymentSessionRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    /**
     * Pays {@code authorizedAmount} USD upfront, then creates an ACTIVE session for it.
     *
     * @param durationHours null for the configured default
     * @throws PaymentFailedException when the payment was not submitted; no session is created
     */
    public PaymentSession open(String payerAddress, BigDecimal authorizedAmount, String resourcePattern,
                               Long durationHours, boolean autoRenew, TransferSigner signer) {
        requirePositive(authorizedAmount);
        if (authorizedAmount.compareTo(sessionProperties.getMaxAuthorizedAmount()) > 0) {
            throw new SessionException(SessionException.Code.INVALID_AMOUNT,
                    "Authorized amount exceeds " + sessionProperties.getMaxAuthorizedAmount());
        }
        long hours = durationHours != null ? durationHours : sessionProperties.getDefaultDurationHours();
        if (hours <= 0 || hours > sessionProperties.getMaxDurationHours()) {
            throw new IllegalArgumentException("Session duration must be between 1 and "
                    + sessionProperties.getMaxDurationHours() + " hours");
        }

        TransactionRecord payment = transactionSubmitter.pay(payerAddress, authorizedAmount, TransactionKind.SESSION_OPEN, signer);

        Instant now = clock.instant();
        PaymentSession session = new PaymentSession();
        session.setToken(newToken());
        session.setPayerAddress(payerAddress);
        session.setResourcePattern(resourcePattern != null && !resourcePattern.isBlank() ? resourcePattern.trim() : "*");
        session.setAuthorizedAmount(authorizedAmount);
        session.setSpentAmount(BigDecimal.ZERO);
        session.setRemainingAmount(authorizedAmount);
        session.setStatus(SessionStatus.ACTIVE);
        session.setExpiresAt(now.plus(Duration.ofHours(hours)));
        session.setAutoRenew(autoRenew);
        session.setRenewalAmount(autoRenew ? authorizedAmount : BigDecimal.ZERO);
        session.setOpeningTransaction(payment.getSignature());
        session.setCreatedAt(now);
        PaymentSession saved = paymentSessionRepository.save(session);
        log.info("Opened session for {}: {} USD until {} (payment {})",
                payerAddress, authorizedAmount, saved.getExpiresAt(), payment.getSignature());
        return saved;
    }

    /**
     * Checks that the session exists, is ACTIVE, not past its expiry and can cover {@code amount}.
     * An ACTIVE session found past expiry is moved to EXPIRED here.
     */
    public PaymentSession validate(String token, BigDecimal amount) {
        requirePositive(amount);
        PaymentSession session = paymentSessionRepository.findByToken(token)
                .orElseThrow(() -> new SessionException(SessionException.Code.SESSION_NOT_FOUND, "Session not found"));
        checkUsable(session);
        if (session.getRemainingAmount().compareTo(amount) < 0) {
            throw new SessionException(SessionException.Code.INSUFFICIENT_SESSION_BALANCE,
                    "Session has " + session.getRemainingAmount() + " remaining, " + amount + " required");
        }
        return session;
    }

    /**
     * Deducts {@code amount} and logs a COMPLETED usage record (no on-chain leg).
     *
     * @return the session after the spend
     */
    public PaymentSession spend(String token, BigDecimal amount, String resourceUrl, ResourceType resourceType,
                                String httpMethod) {
        validate(token, amount);
        Instant now = clock.instant();
        PaymentSession updated = paymentSessionRepository.debit(token, amount, now)
                .orElseThrow(() -> rejectedSpend(token, amount));
        if (updated.getRemainingAmount().signum() == 0 && paymentSessionRepository.markDepletedIfExhausted(token)) {
            updated.setStatus(SessionStatus.DEPLETED);
            log.info("Session {} depleted", abbreviate(token));
        }

        UsageRecord usage = new UsageRecord();
        usage.setSessionId(token);
        usage.setPayerAddress(updated.getPayerAddress());
        usage.setResourceUrl(resourceUrl);
        usage.setResourceType(resourceType != null ? resourceType : ResourceType.API_CALL);
        usage.setHttpMethod(httpMethod != null ? httpMethod : "GET");
        usage.setAmountCharged(amount);
        usage.setStatus(UsageStatus.COMPLETED);
        usage.setCreatedAt(now);
        usageRecordRepository.save(usage);
        return updated;
    }

    /**
     * ACTIVE to REVOKED. Terminal sessions are left unchanged and reported with their status code.
     */
    public PaymentSession revoke(String token) {
        if (paymentSessionRepository.transition(token, SessionStatus.ACTIVE, SessionStatus.REVOKED)) {
            log.info("Session {} revoked", abbreviate(token));
        } else {
            PaymentSession current = paymentSessionRepository.findByToken(token)
                    .orElseThrow(() -> new SessionException(SessionException.Code.SESSION_NOT_FOUND, "Session not found"));
            throw terminal(current.getStatus());
        }
        return paymentSessionRepository.findByToken(token)
                .orElseThrow(() -> new SessionException(SessionException.Code.SESSION_NOT_FOUND, "Session not found"));
    }

    public Optional<PaymentSession> find(String token) {
        return paymentSessionRepository.findByToken(token);
    }

    public List<PaymentSession> sessionsFor(String payerAddress) {
        return paymentSessionRepository.findByPayerAddressOrderByCreatedAtDesc(payerAddress);
    }

    /**
     * Marks overdue ACTIVE sessions EXPIRED.
     */
    @Scheduled(
            fixedDelayString = "${meterpay.session.expiry-sweep-interval-ms:300000}",
            initialDelayString = "${meterpay.session.expiry-sweep-interval-ms:300000}")
    public long expireOverdue() {
        long expired = paymentSessionRepository.expireOverdue(clock.instant());
        if (expired > 0) {
            log.info("Expired {} overdue sessions", expired);
        }
        return expired;
    }

    private void checkUsable(PaymentSession session) {
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw terminal(session.getStatus());
        }
        if (clock.instant().isAfter(session.getExpiresAt())) {
            paymentSessionRepository.transition(session.getToken(), SessionStatus.ACTIVE, SessionStatus.EXPIRED);
            throw terminal(SessionStatus.EXPIRED);
        }
    }

    /** The conditional debit matched nothing; re-read to report why. */
    private SessionException rejectedSpend(String token, BigDecimal amount) {
        try {
            validate(token, amount);
        } catch (SessionException e) {
            return e;
        }
        return new SessionException(SessionException.Code.INSUFFICIENT_SESSION_BALANCE, "Session balance changed concurrently");
    }

    private static SessionException terminal(SessionStatus status) {
        return switch (status) {
            case EXPIRED -> new SessionException(SessionException.Code.SESSION_EXPIRED, "Session has expired");
            case REVOKED -> new SessionException(SessionException.Code.SESSION_REVOKED, "Session was revoked");
            case DEPLETED -> new SessionException(SessionException.Code.SESSION_DEPLETED, "Session is fully spent");
            case ACTIVE -> throw new IllegalStateException("Session is active");
        };
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new SessionException(SessionException.Code.INVALID_AMOUNT, "Amount must be positive");
        }
    }

    private static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String abbreviate(String token) {
        return token.length() > 8 ? token.substring(0, 8) + "..." : token;
    }
}
