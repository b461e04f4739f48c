package com.meterpay.api.controller;

import com.meterpay.api.dto.AutoTopupRequest;
import com.meterpay.api.dto.BalanceResponse;
import com.meterpay.api.dto.CreditAccountResponse;
import com.meterpay.api.dto.CreditSpendRequest;
import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.validation.AddressValidator;
import com.meterpay.credit.CreditLedgerService;
import com.meterpay.domain.ServiceType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * Credit balances, spends and auto top-up settings per wallet. Top-ups need payer-side signing and are
 * done through {@link CreditLedgerService#topUp}.
 */
@RestController
@RequestMapping("/api/v1/credits/{wallet}")
@RequiredArgsConstructor
public class CreditController {

    private final CreditLedgerService creditLedgerService;
    private final AddressValidator addressValidator;

    @GetMapping
    public ResponseEntity<?> accounts(@PathVariable String wallet) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(creditLedgerService.accountsFor(wallet).stream()
                .map(CreditAccountResponse::from)
                .toList());
    }

    @GetMapping("/balance")
    public ResponseEntity<?> balance(@PathVariable String wallet,
                                     @RequestParam String serviceId,
                                     @RequestParam ServiceType serviceType) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        BigDecimal balance = creditLedgerService.balance(wallet, serviceId, serviceType);
        return ResponseEntity.ok(new BalanceResponse(wallet, serviceId, serviceType.name(), balance));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats(@PathVariable String wallet) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(creditLedgerService.stats(wallet));
    }

    @PostMapping("/spend")
    public ResponseEntity<?> spend(@PathVariable String wallet, @Valid @RequestBody CreditSpendRequest request) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(CreditAccountResponse.from(
                creditLedgerService.spend(wallet, request.serviceId(), request.serviceType(), request.amount())));
    }

    @PutMapping("/auto-topup")
    public ResponseEntity<?> enableAutoTopup(@PathVariable String wallet, @Valid @RequestBody AutoTopupRequest request) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(CreditAccountResponse.from(creditLedgerService.enableAutoTopup(
                wallet, request.serviceId(), request.serviceType(), request.threshold(), request.amount())));
    }

    @DeleteMapping("/auto-topup")
    public ResponseEntity<?> disableAutoTopup(@PathVariable String wallet,
                                              @RequestParam String serviceId,
                                              @RequestParam ServiceType serviceType) {
        if (!addressValidator.isValidAddress(wallet)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(CreditAccountResponse.from(
                creditLedgerService.disableAutoTopup(wallet, serviceId, serviceType)));
    }

    private static ResponseEntity<ErrorBody> invalidAddress() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address"));
    }
}
