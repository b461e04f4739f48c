package com.meterpay.settlement.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment submission settings under meterpay.settlement.
 */
@ConfigurationProperties(prefix = "meterpay.settlement")
@NoArgsConstructor
@Getter
@Setter
public class SettlementProperties {

    /** Wallet receiving session and credit payments. */
    private String recipientWallet = "FbRDjtZRRtLmjok6NvzsxSey4gDAoTmr8RacPiaRZEWX";

    /** Fee reserved on top of the transfer when checking the payer's balance. */
    private long feeEstimateLamports = 5_000;
}
