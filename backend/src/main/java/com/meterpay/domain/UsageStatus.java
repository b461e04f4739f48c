package com.meterpay.domain;

public enum UsageStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED
}
