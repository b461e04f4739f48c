package com.meterpay.ledger;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Operations needed from the settlement network. Implementations route every call through the
 * {@link EndpointFailoverPool} and surface {@link EndpointPoolExhaustedException} when no endpoint answers.
 */
public interface SettlementLedger {

    /**
     * Submits a signed, base64-encoded transaction and returns its signature.
     *
     * @throws TransactionRejectedException when the ledger refuses the transaction
     */
    String submitTransaction(String signedTransactionBase64);

    LedgerStatus getTransactionStatus(String signature);

    /** Native (SOL) balance of the address. */
    BigDecimal getBalance(String address);

    /** USD price published on a price account, or empty when the account holds no usable price. */
    Optional<BigDecimal> getLatestReferencePrice(String priceAccount);

    String getLatestBlockhash();

    /** Details of a landed transaction, or empty when the ledger does not know it. */
    Optional<TransferDetails> getTransfer(String signature);
}
