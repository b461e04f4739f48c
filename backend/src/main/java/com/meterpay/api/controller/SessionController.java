package com.meterpay.api.controller;

import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.dto.SessionResponse;
import com.meterpay.api.dto.SpendRequest;
import com.meterpay.api.dto.SpendResponse;
import com.meterpay.api.validation.AddressValidator;
import com.meterpay.domain.PaymentSession;
import com.meterpay.session.PaymentSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session lookup, spend and revoke. Opening a session needs payer-side signing and is done through
 * {@link PaymentSessionService#open}.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final PaymentSessionService paymentSessionService;
    private final AddressValidator addressValidator;

    @GetMapping("/{token}")
    public ResponseEntity<SessionResponse> get(@PathVariable String token) {
        return paymentSessionService.find(token)
                .map(s -> ResponseEntity.ok(SessionResponse.from(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<?> listForWallet(@RequestParam String wallet) {
        if (!addressValidator.isValidAddress(wallet)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address"));
        }
        List<SessionResponse> sessions = paymentSessionService.sessionsFor(wallet.trim()).stream()
                .map(SessionResponse::from)
                .toList();
        return ResponseEntity.ok(sessions);
    }

    @PostMapping("/{token}/spend")
    public ResponseEntity<SpendResponse> spend(@PathVariable String token, @Valid @RequestBody SpendRequest request) {
        PaymentSession after = paymentSessionService.spend(token, request.amount(), request.resourceUrl(),
                request.resourceType(), request.httpMethod());
        return ResponseEntity.ok(new SpendResponse(token, request.amount(), after.getRemainingAmount(),
                after.getStatus().name()));
    }

    @PostMapping("/{token}/revoke")
    public ResponseEntity<SessionResponse> revoke(@PathVariable String token) {
        return ResponseEntity.ok(SessionResponse.from(paymentSessionService.revoke(token)));
    }
}
