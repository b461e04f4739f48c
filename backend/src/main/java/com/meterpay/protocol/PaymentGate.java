package com.meterpay.protocol;

import com.meterpay.domain.PaymentSession;
import com.meterpay.domain.ResourceType;
import com.meterpay.domain.ServiceConfig;
import com.meterpay.domain.ServiceType;
import com.meterpay.domain.UsageRecord;
import com.meterpay.domain.UsageRecordRepository;
import com.meterpay.domain.UsageStatus;
import com.meterpay.session.PaymentSessionService;
import com.meterpay.session.ResourcePattern;
import com.meterpay.session.SessionException;
import com.meterpay.settlement.config.SettlementProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Decides whether a metered request may proceed given its {@value PaymentHeaderCodec#HEADER_NAME} header.
 * A session token is spent through the session manager; a proof is verified on chain and consumed once;
 * anything else is answered with {@link PaymentRequiredException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentGate {

    private final ServiceCatalog serviceCatalog;
    private final PaymentSessionService paymentSessionService;
    private final PaymentProofVerifier paymentProofVerifier;
    private final UsageRecordRepository usageRecordRepository;
    private final SettlementProperties settlementProperties;
    private final ProtocolProperties protocolProperties;
    private final Clock clock;

    public AccessGrant authorize(String serviceId, ServiceType serviceType, String resourceUrl, String httpMethod,
                                 String rawHeader) {
        ServiceConfig service = serviceCatalog.find(serviceId, serviceType)
                .orElseThrow(() -> new PaymentGateException(PaymentGateException.Code.SERVICE_NOT_FOUND,
                        "Unknown service " + serviceType + "/" + serviceId));
        if (!service.isActive()) {
            throw new PaymentGateException(PaymentGateException.Code.SERVICE_INACTIVE, "Service is not active");
        }
        if (!service.isAcceptsX402()) {
            throw new PaymentGateException(PaymentGateException.Code.PAYMENTS_NOT_ACCEPTED,
                    "Service does not accept metered payments");
        }
        BigDecimal price = priceOf(service);
        String recipient = service.getOwnerWallet() != null && !service.getOwnerWallet().isBlank()
                ? service.getOwnerWallet()
                : settlementProperties.getRecipientWallet();
        String resource = resourceUrl != null ? resourceUrl : ResourcePattern.forService(serviceType.name(), serviceId);
        if (price.signum() == 0) {
            return new AccessGrant(AccessGrant.Mode.FREE, BigDecimal.ZERO, null, null);
        }

        if (rawHeader == null || rawHeader.isBlank()) {
            throw paymentRequired(price, recipient, serviceType, serviceId);
        }
        PaymentHeader header = PaymentHeaderCodec.parse(rawHeader);
        ResourceType resourceType = ResourceType.forServiceType(serviceType);

        if (header.hasSession()) {
            return chargeSession(header, price, resource, resourceType, httpMethod);
        }
        if (header.hasProof()) {
            return chargeProof(header, rawHeader, price, recipient, serviceId, resource, resourceType, httpMethod);
        }
        throw paymentRequired(price, recipient, serviceType, serviceId);
    }

    private AccessGrant chargeSession(PaymentHeader header, BigDecimal price, String resource,
                                     ResourceType resourceType, String httpMethod) {
        PaymentSession session = paymentSessionService.find(header.sessionToken())
                .orElseThrow(() -> new SessionException(SessionException.Code.SESSION_NOT_FOUND, "Session not found"));
        if (!session.getPayerAddress().equals(header.walletAddress())) {
            throw new PaymentGateException(PaymentGateException.Code.WRONG_PAYER, "Session belongs to another wallet");
        }
        if (!ResourcePattern.matches(session.getResourcePattern(), resource)) {
            throw new SessionException(SessionException.Code.RESOURCE_MISMATCH,
                    "Session does not cover " + resource);
        }
        PaymentSession after = paymentSessionService.spend(header.sessionToken(), price, resource, resourceType, httpMethod);
        return new AccessGrant(AccessGrant.Mode.SESSION, price, after.getRemainingAmount(), header.sessionToken());
    }

    private AccessGrant chargeProof(PaymentHeader header, String rawHeader, BigDecimal price, String recipient,
                                   String serviceId, String resource, ResourceType resourceType, String httpMethod) {
        VerifiedPayment payment = paymentProofVerifier.verify(header.proof(), header.walletAddress(), recipient, price);
        UsageRecord usage = new UsageRecord();
        usage.setPayerAddress(payment.payerAddress());
        usage.setServiceId(serviceId);
        usage.setResourceUrl(resource);
        usage.setResourceType(resourceType);
        usage.setHttpMethod(httpMethod != null ? httpMethod : "GET");
        usage.setAmountCharged(price);
        usage.setPaymentHeader(rawHeader);
        usage.setPaymentProof(payment.signature());
        usage.setStatus(UsageStatus.COMPLETED);
        usage.setCreatedAt(clock.instant());
        try {
            usageRecordRepository.insert(usage);
        } catch (DuplicateKeyException e) {
            throw new PaymentGateException(PaymentGateException.Code.PROOF_REUSED, "Payment proof was already used");
        }
        log.info("Accepted proof {} for {} ({} lamports)", payment.signature(), resource, payment.lamports());
        return new AccessGrant(AccessGrant.Mode.PROOF, price, null, payment.signature());
    }

    private PaymentRequiredException paymentRequired(BigDecimal price, String recipient, ServiceType serviceType,
                                                     String serviceId) {
        return new PaymentRequiredException(price, protocolProperties.getCurrency(), recipient,
                ResourcePattern.forService(serviceType.name(), serviceId));
    }

    private static BigDecimal priceOf(ServiceConfig service) {
        BigDecimal base = service.getBasePrice() != null ? service.getBasePrice() : BigDecimal.ZERO;
        if (service.getMinPayment() != null && base.compareTo(service.getMinPayment()) < 0) {
            return service.getMinPayment();
        }
        return base;
    }
}
