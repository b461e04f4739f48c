package com.meterpay.protocol;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the {@value #HEADER_NAME} header:
 * {@code session=<token>; wallet=<address>; amount=<usd>; currency=<unit>; timestamp=<epoch-ms>[; proof=<sig>][; signature=<sig>]}.
 * Keys are case-insensitive and unordered; unknown keys are ignored. wallet is required, amount defaults
 * to 0, currency to USDC, timestamp to the parse time.
 */
public final class PaymentHeaderCodec {

    public static final String HEADER_NAME = "X-402-Payment";
    public static final String DEFAULT_CURRENCY = "USDC";

    private PaymentHeaderCodec() {
    }

    public static PaymentHeader parse(String header) {
        if (header == null || header.isBlank()) {
            throw new InvalidPaymentHeaderException("Payment header is empty");
        }
        Map<String, String> fields = new HashMap<>();
        for (String part : header.split(";")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new InvalidPaymentHeaderException("Malformed payment header field: " + trimmed);
            }
            fields.put(trimmed.substring(0, eq).trim().toLowerCase(Locale.ROOT), trimmed.substring(eq + 1).trim());
        }
        String wallet = blankToNull(fields.get("wallet"));
        if (wallet == null) {
            throw new InvalidPaymentHeaderException("Payment header has no wallet");
        }
        return new PaymentHeader(
                blankToNull(fields.get("session")),
                wallet,
                amount(fields.get("amount")),
                fields.getOrDefault("currency", DEFAULT_CURRENCY),
                timestamp(fields.get("timestamp")),
                blankToNull(fields.get("proof")),
                blankToNull(fields.get("signature")));
    }

    public static String format(PaymentHeader header) {
        StringBuilder sb = new StringBuilder();
        sb.append("session=").append(header.sessionToken() != null ? header.sessionToken() : "");
        sb.append("; wallet=").append(header.walletAddress());
        sb.append("; amount=").append(header.amount() != null ? header.amount().toPlainString() : "0");
        sb.append("; currency=").append(header.currency() != null ? header.currency() : DEFAULT_CURRENCY);
        sb.append("; timestamp=").append(header.timestamp());
        if (header.hasProof()) {
            sb.append("; proof=").append(header.proof());
        }
        if (header.signature() != null && !header.signature().isBlank()) {
            sb.append("; signature=").append(header.signature());
        }
        return sb.toString();
    }

    private static BigDecimal amount(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new InvalidPaymentHeaderException("Invalid amount: " + value);
        }
    }

    private static long timestamp(String value) {
        if (value == null || value.isBlank()) {
            return System.currentTimeMillis();
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidPaymentHeaderException("Invalid timestamp: " + value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
