package com.meterpay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Pricing and acceptance settings of a metered service. Maintained by the catalog; read-only here.
 */
@Document(collection = "service_configs")
@CompoundIndex(name = "service_key", def = "{'serviceId': 1, 'serviceType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ServiceConfig {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String serviceId;
    private ServiceType serviceType;
    private String serviceName;
    private String ownerWallet;
    private boolean acceptsX402;
    private PricingModel pricingModel;
    /** USD charged per unit of the pricing model. */
    private BigDecimal basePrice;
    private BigDecimal minPayment;
    private BigDecimal maxPayment;
    private boolean requiresPreauth;
    private BigDecimal maxSessionAmount;
    private boolean active;
}
