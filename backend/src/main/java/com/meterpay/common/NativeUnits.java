package com.meterpay.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between SOL and lamports (1 SOL = 1e9 lamports).
 */
public final class NativeUnits {

    public static final long LAMPORTS_PER_SOL = 1_000_000_000L;
    public static final int NATIVE_SCALE = 9;

    private static final BigDecimal LAMPORTS = BigDecimal.valueOf(LAMPORTS_PER_SOL);

    private NativeUnits() {
    }

    /**
     * Lamports for the given SOL amount, rounded up so a transfer never underpays.
     */
    public static long toLamports(BigDecimal sol) {
        if (sol == null || sol.signum() < 0) {
            throw new IllegalArgumentException("Native amount must be non-negative");
        }
        return sol.multiply(LAMPORTS).setScale(0, RoundingMode.CEILING).longValueExact();
    }

    public static BigDecimal toSol(long lamports) {
        return BigDecimal.valueOf(lamports).divide(LAMPORTS, NATIVE_SCALE, RoundingMode.UNNECESSARY);
    }
}
