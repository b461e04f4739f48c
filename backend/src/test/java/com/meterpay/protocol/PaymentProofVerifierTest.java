package com.meterpay.protocol;

import com.meterpay.domain.PriceSource;
import com.meterpay.domain.UsageRecordRepository;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.ledger.TransferDetails;
import com.meterpay.pricing.PriceOracle;
import com.meterpay.pricing.PriceQuote;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentProofVerifierTest {

    private static final String PROOF = "proof-sig";
    private static final String PAYER = "Payer1111111111111111111111111111111111111";
    private static final String OWNER = "Owner1111111111111111111111111111111111111";
    private static final BigDecimal PRICE = new BigDecimal("1.00");

    @Mock
    SettlementLedger settlementLedger;
    @Mock
    PriceOracle priceOracle;
    @Mock
    UsageRecordRepository usageRecordRepository;

    private PaymentProofVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new PaymentProofVerifier(settlementLedger, priceOracle, usageRecordRepository, new ProtocolProperties());
        lenient().when(priceOracle.quote(PRICE)).thenReturn(new PriceQuote(PRICE, new BigDecimal("0.010000000"),
                new BigDecimal("100"), Instant.parse("2025-03-01T12:00:00Z"), PriceSource.PYTH_ONCHAIN));
    }

    @Test
    @DisplayName("minimum is the quoted lamports less the two percent tolerance")
    void minimumLamports() {
        assertThat(verifier.minimumLamports(PRICE)).isEqualTo(9_800_000L);
    }

    @Test
    @DisplayName("a successful transfer from the payer covering the price is accepted")
    void accepts() {
        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.of(transfer(null, PAYER, 9_900_000L)));

        VerifiedPayment payment = verifier.verify(PROOF, PAYER, OWNER, PRICE);

        assertThat(payment.lamports()).isEqualTo(9_900_000L);
        assertThat(payment.payerAddress()).isEqualTo(PAYER);
        assertThat(payment.nativeAmount()).isEqualByComparingTo("0.0099");
    }

    @Test
    @DisplayName("rejections: reused, missing, failed, wrong payer, wrong recipient, underpaid")
    void rejects() {
        lenient().when(usageRecordRepository.existsByPaymentProof("used")).thenReturn(true);
        assertCode(() -> verifier.verify("used", PAYER, OWNER, PRICE), PaymentGateException.Code.PROOF_REUSED);

        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.empty());
        assertCode(() -> verifier.verify(PROOF, PAYER, OWNER, PRICE), PaymentGateException.Code.PROOF_NOT_FOUND);

        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.of(transfer("{\"InstructionError\":[0]}", PAYER, 10_000_000L)));
        assertCode(() -> verifier.verify(PROOF, PAYER, OWNER, PRICE), PaymentGateException.Code.PROOF_FAILED);

        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.of(transfer(null, "Someone1111111111111111111111111111111111", 10_000_000L)));
        assertCode(() -> verifier.verify(PROOF, PAYER, OWNER, PRICE), PaymentGateException.Code.WRONG_PAYER);

        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.of(transfer(null, PAYER, 0L)));
        assertCode(() -> verifier.verify(PROOF, PAYER, OWNER, PRICE), PaymentGateException.Code.WRONG_RECIPIENT);

        when(settlementLedger.getTransfer(PROOF)).thenReturn(Optional.of(transfer(null, PAYER, 9_799_999L)));
        assertCode(() -> verifier.verify(PROOF, PAYER, OWNER, PRICE), PaymentGateException.Code.UNDERPAID);
    }

    private static void assertCode(ThrowingCallable call, PaymentGateException.Code code) {
        assertThatThrownBy(call)
                .isInstanceOf(PaymentGateException.class)
                .extracting(e -> ((PaymentGateException) e).getCode())
                .isEqualTo(code);
    }

    private static TransferDetails transfer(String error, String feePayer, long receivedLamports) {
        return new TransferDetails(PROOF, error, List.of(feePayer, OWNER),
                List.of(50_000_000L, 1_000L), List.of(50_000_000L - receivedLamports - 5_000L, 1_000L + receivedLamports));
    }
}
