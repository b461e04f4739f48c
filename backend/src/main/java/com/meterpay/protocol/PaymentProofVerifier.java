package com.meterpay.protocol;

import com.meterpay.common.NativeUnits;
import com.meterpay.domain.UsageRecordRepository;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.ledger.TransferDetails;
import com.meterpay.pricing.PriceOracle;
import com.meterpay.pricing.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Checks a standalone on-chain payment offered as proof: it must have landed without error, been paid
 * by the header's wallet, credited the recipient at least the required amount (at the current rate,
 * less the configured tolerance) and not have been accepted before.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentProofVerifier {

    private final SettlementLedger settlementLedger;
    private final PriceOracle priceOracle;
    private final UsageRecordRepository usageRecordRepository;
    private final ProtocolProperties protocolProperties;

    public VerifiedPayment verify(String proofSignature, String payerAddress, String recipientAddress,
                                  BigDecimal requiredReferenceAmount) {
        if (usageRecordRepository.existsByPaymentProof(proofSignature)) {
            throw new PaymentGateException(PaymentGateException.Code.PROOF_REUSED, "Payment proof was already used");
        }
        TransferDetails transfer = settlementLedger.getTransfer(proofSignature)
                .orElseThrow(() -> new PaymentGateException(PaymentGateException.Code.PROOF_NOT_FOUND,
                        "Proof transaction not found or not yet confirmed"));
        if (!transfer.succeeded()) {
            throw new PaymentGateException(PaymentGateException.Code.PROOF_FAILED,
                    "Proof transaction failed on chain: " + transfer.error());
        }
        if (payerAddress != null && !payerAddress.equals(transfer.feePayer())) {
            throw new PaymentGateException(PaymentGateException.Code.WRONG_PAYER,
                    "Proof transaction was not paid by " + payerAddress);
        }
        long received = transfer.lamportsReceivedBy(recipientAddress);
        if (received <= 0) {
            throw new PaymentGateException(PaymentGateException.Code.WRONG_RECIPIENT,
                    "Proof transaction does not pay " + recipientAddress);
        }
        long minimum = minimumLamports(requiredReferenceAmount);
        if (received < minimum) {
            log.warn("Underpaid proof {}: {} lamports received, {} required", proofSignature, received, minimum);
            throw new PaymentGateException(PaymentGateException.Code.UNDERPAID,
                    "Proof pays " + NativeUnits.toSol(received) + " SOL, at least " + NativeUnits.toSol(minimum) + " required");
        }
        return new VerifiedPayment(proofSignature, transfer.feePayer(), recipientAddress, received, NativeUnits.toSol(received));
    }

    long minimumLamports(BigDecimal requiredReferenceAmount) {
        PriceQuote quote = priceOracle.quote(requiredReferenceAmount);
        BigDecimal factor = BigDecimal.ONE.subtract(protocolProperties.getProofTolerance());
        BigDecimal minimumNative = quote.nativeAmount().multiply(factor).setScale(NativeUnits.NATIVE_SCALE, RoundingMode.DOWN);
        return NativeUnits.toLamports(minimumNative.max(BigDecimal.ZERO));
    }
}
