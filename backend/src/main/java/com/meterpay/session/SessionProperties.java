package com.meterpay.session;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Session defaults under meterpay.session.
 */
@ConfigurationProperties(prefix = "meterpay.session")
@NoArgsConstructor
@Getter
@Setter
public class SessionProperties {

    private long defaultDurationHours = 24;

    private long maxDurationHours = 720;

    /** Upper bound on the USD amount one session may authorize. */
    private BigDecimal maxAuthorizedAmount = new BigDecimal("1000");
}
