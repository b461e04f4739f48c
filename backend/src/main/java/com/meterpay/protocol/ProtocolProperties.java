package com.meterpay.protocol;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Metered access settings under meterpay.protocol.
 */
@ConfigurationProperties(prefix = "meterpay.protocol")
@NoArgsConstructor
@Getter
@Setter
public class ProtocolProperties {

    /** Fraction a proof payment may fall short of the required SOL amount (rate drift). */
    private BigDecimal proofTolerance = new BigDecimal("0.02");

    /** Unit advertised in payment-required responses. */
    private String currency = PaymentHeaderCodec.DEFAULT_CURRENCY;
}
