package com.meterpay.api.controller;

import com.meterpay.api.dto.ErrorBody;
import com.meterpay.pricing.PriceOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;

/**
 * GET /quotes?amount=&from=USD|SOL: current conversion with its rate source. Price sources block, so the
 * oracle is called on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final PriceOracle priceOracle;

    @GetMapping
    public Mono<ResponseEntity<?>> quote(@RequestParam BigDecimal amount,
                                         @RequestParam(defaultValue = "USD") String from) {
        if (amount.signum() < 0) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_AMOUNT", "Amount must be non-negative")));
        }
        boolean fromNative = "SOL".equalsIgnoreCase(from);
        if (!fromNative && !"USD".equalsIgnoreCase(from)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CURRENCY", "from must be USD or SOL")));
        }
        return Mono.fromCallable(() -> fromNative ? priceOracle.toReference(amount) : priceOracle.quote(amount))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(ResponseEntity::ok);
    }
}
