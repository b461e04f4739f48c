package com.meterpay.ledger;

import java.util.List;

/**
 * Parsed view of a landed transaction used to verify a payment proof.
 * accountKeys[0] is the fee payer; balances are lamports indexed like accountKeys.
 */
public record TransferDetails(String signature,
                              String error,
                              List<String> accountKeys,
                              List<Long> preBalances,
                              List<Long> postBalances) {

    public boolean succeeded() {
        return error == null;
    }

    public String feePayer() {
        return accountKeys.isEmpty() ? null : accountKeys.get(0);
    }

    /**
     * Net lamports credited to {@code address} by this transaction; 0 when the address is not involved.
     */
    public long lamportsReceivedBy(String address) {
        int index = accountKeys.indexOf(address);
        if (index < 0 || index >= preBalances.size() || index >= postBalances.size()) {
            return 0L;
        }
        return postBalances.get(index) - preBalances.get(index);
    }
}
