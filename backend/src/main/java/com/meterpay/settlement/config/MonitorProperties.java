package com.meterpay.settlement.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Confirmation polling and reconciliation settings under meterpay.monitor.
 */
@ConfigurationProperties(prefix = "meterpay.monitor")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    private long pollIntervalMs = 5_000;

    /** Polling stops after this long; the record stays PENDING for reconciliation. */
    private long timeoutMs = 300_000;

    /** PENDING records younger than this are left to the live monitor. */
    private long reconcileGraceMs = 60_000;

    private long reconcileIntervalMs = 60_000;

    /** PENDING records older than this are no longer re-polled. */
    private long reconcileMaxAgeMs = 86_400_000;

    private int workers = 4;
}
