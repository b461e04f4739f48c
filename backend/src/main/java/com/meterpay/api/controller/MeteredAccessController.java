package com.meterpay.api.controller;

import com.meterpay.api.dto.AccessResponse;
import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.validation.ServiceTypes;
import com.meterpay.domain.ServiceType;
import com.meterpay.protocol.PaymentGate;
import com.meterpay.protocol.PaymentHeaderCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * POST /metered/{serviceType}/{serviceId}/access: charges one use of a service from the payment header.
 * 200 when granted, 402 with the amount to pay when the header is missing or carries no evidence.
 * The gate blocks on Mongo and RPC calls, so it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/metered")
@RequiredArgsConstructor
public class MeteredAccessController {

    private final PaymentGate paymentGate;

    @PostMapping("/{serviceType}/{serviceId}/access")
    public Mono<ResponseEntity<?>> access(@PathVariable String serviceType,
                                          @PathVariable String serviceId,
                                          @RequestParam(required = false) String resource,
                                          @RequestParam(defaultValue = "GET") String method,
                                          @RequestHeader(name = PaymentHeaderCodec.HEADER_NAME, required = false) String payment) {
        Optional<ServiceType> type = ServiceTypes.parse(serviceType);
        if (type.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_SERVICE_TYPE", "Unknown service type")));
        }
        return Mono.fromCallable(() -> paymentGate.authorize(serviceId, type.get(), resource, method, payment))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(grant -> ResponseEntity.ok(new AccessResponse(true, grant.mode().name(), grant.amountCharged(),
                        grant.remainingBalance(), grant.reference())));
    }
}
