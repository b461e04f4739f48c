package com.meterpay.domain;

/**
 * Purpose of an on-chain payment.
 * <p>
 * {@link #SESSION_USE} and {@link #CREDIT_SPEND} are reserved: session uses are tracked as
 * {@link UsageRecord}s and credit spends are balance updates, so neither writes a transaction record today.
 * Both stay in the vocabulary so stored records written by other tools still parse.
 */
public enum TransactionKind {
    SESSION_OPEN,
    SESSION_USE,
    CREDIT_TOPUP,
    CREDIT_SPEND,
    OTHER
}
