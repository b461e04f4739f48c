package com.meterpay.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Conditional updates for payment_sessions. Every write is a single findAndModify so concurrent
 * spends against the same token serialize in the store.
 */
public interface PaymentSessionRepositoryCustom {

    /**
     * Debits the session when it is ACTIVE, not past expiresAt and has at least {@code amount} remaining.
     * Returns the updated session, or empty when any condition failed (nothing is changed then).
     */
    Optional<PaymentSession> debit(String token, BigDecimal amount, Instant now);

    /**
     * ACTIVE to DEPLETED when remainingAmount is zero. Returns true if this call made the transition.
     */
    boolean markDepletedIfExhausted(String token);

    /**
     * Status transition guarded by the expected current status.
     */
    boolean transition(String token, SessionStatus from, SessionStatus to);

    /**
     * Marks every ACTIVE session whose expiresAt is before {@code now} as EXPIRED.
     */
    long expireOverdue(Instant now);
}
