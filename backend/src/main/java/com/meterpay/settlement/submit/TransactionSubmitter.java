package com.meterpay.settlement.submit;

import com.meterpay.common.NativeUnits;
import com.meterpay.domain.TransactionKind;
import com.meterpay.domain.TransactionRecord;
import com.meterpay.domain.TransactionRecordRepository;
import com.meterpay.domain.TransactionStatus;
import com.meterpay.ledger.EndpointPoolExhaustedException;
import com.meterpay.ledger.RpcException;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.ledger.TransactionRejectedException;
import com.meterpay.pricing.PriceOracle;
import com.meterpay.pricing.PriceQuote;
import com.meterpay.settlement.config.SettlementProperties;
import com.meterpay.settlement.monitor.ConfirmationMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Prices a USD amount in SOL, has the payer sign the transfer, submits it and records it as PENDING.
 * Confirmation is left to the {@link ConfirmationMonitor}; nothing here marks a payment confirmed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionSubmitter {

    private final PriceOracle priceOracle;
    private final SettlementLedger settlementLedger;
    private final TransactionRecordRepository transactionRecordRepository;
    private final ConfirmationMonitor confirmationMonitor;
    private final SettlementProperties settlementProperties;
    private final Clock clock;

    /**
     * Pays {@code referenceAmount} USD from {@code payerAddress} to the configured recipient.
     *
     * @return the PENDING record, already registered for confirmation polling
     * @throws PaymentFailedException when nothing was submitted; no record is created then
     */
    public TransactionRecord pay(String payerAddress, BigDecimal referenceAmount, TransactionKind kind,
                                 TransferSigner signer) {
        if (referenceAmount == null || referenceAmount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        PriceQuote quote = priceOracle.quote(referenceAmount);
        long lamports = NativeUnits.toLamports(quote.nativeAmount());
        String recipient = settlementProperties.getRecipientWallet();

        ensureFunds(payerAddress, lamports);
        String blockhash = latestBlockhash();
        String signedTransaction = sign(signer, new TransferInstruction(payerAddress, recipient, lamports, blockhash));
        String signature = submit(signedTransaction);

        TransactionRecord record = new TransactionRecord();
        record.setSignature(signature);
        record.setPayerAddress(payerAddress);
        record.setKind(kind != null ? kind : TransactionKind.OTHER);
        record.setStatus(TransactionStatus.PENDING);
        record.setNativeAmount(NativeUnits.toSol(lamports));
        record.setReferenceAmount(referenceAmount);
        record.setRate(quote.rate());
        record.setPriceSource(quote.source());
        record.setRecipientAddress(recipient);
        record.setCreatedAt(clock.instant());
        TransactionRecord saved = transactionRecordRepository.save(record);
        log.info("Submitted {} payment {}: {} USD = {} lamports at {} ({})",
                record.getKind(), signature, referenceAmount, lamports, quote.rate(), quote.source());

        confirmationMonitor.register(signature);
        return saved;
    }

    private void ensureFunds(String payerAddress, long lamports) {
        BigDecimal balance;
        try {
            balance = settlementLedger.getBalance(payerAddress);
        } catch (EndpointPoolExhaustedException | RpcException e) {
            throw new PaymentFailedException(PaymentFailedException.Reason.NETWORK, "Could not read payer balance", e);
        }
        long required = lamports + settlementProperties.getFeeEstimateLamports();
        if (balance.compareTo(NativeUnits.toSol(required)) < 0) {
            throw new PaymentFailedException(PaymentFailedException.Reason.INSUFFICIENT_FUNDS,
                    "Balance " + balance + " SOL is below required " + NativeUnits.toSol(required) + " SOL");
        }
    }

    private String latestBlockhash() {
        try {
            return settlementLedger.getLatestBlockhash();
        } catch (EndpointPoolExhaustedException | RpcException e) {
            throw new PaymentFailedException(PaymentFailedException.Reason.NETWORK, "Could not fetch recent blockhash", e);
        }
    }

    private static String sign(TransferSigner signer, TransferInstruction instruction) {
        try {
            return signer.sign(instruction);
        } catch (TransferRejectedException e) {
            throw new PaymentFailedException(PaymentFailedException.Reason.REJECTED, e.getMessage(), e);
        }
    }

    private String submit(String signedTransaction) {
        try {
            return settlementLedger.submitTransaction(signedTransaction);
        } catch (TransactionRejectedException e) {
            PaymentFailedException.Reason reason = e.isInsufficientFunds()
                    ? PaymentFailedException.Reason.INSUFFICIENT_FUNDS
                    : PaymentFailedException.Reason.LEDGER_REJECTED;
            throw new PaymentFailedException(reason, e.getMessage(), e);
        } catch (EndpointPoolExhaustedException | RpcException e) {
            throw new PaymentFailedException(PaymentFailedException.Reason.NETWORK, "Could not submit transaction", e);
        }
    }
}
