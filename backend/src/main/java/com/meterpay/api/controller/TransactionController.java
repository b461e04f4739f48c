package com.meterpay.api.controller;

import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.dto.TransactionResponse;
import com.meterpay.api.validation.AddressValidator;
import com.meterpay.settlement.TransactionLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /transactions/{signature}, GET /transactions?wallet=&limit=, GET /transactions/stats.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionLogService transactionLogService;
    private final AddressValidator addressValidator;

    @GetMapping("/{signature}")
    public ResponseEntity<TransactionResponse> get(@PathVariable String signature) {
        return transactionLogService.find(signature)
                .map(r -> ResponseEntity.ok(TransactionResponse.from(r)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<?> history(@RequestParam String wallet, @RequestParam(defaultValue = "50") int limit) {
        if (!addressValidator.isValidAddress(wallet)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address"));
        }
        return ResponseEntity.ok(transactionLogService.history(wallet.trim(), limit).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats(@RequestParam(required = false) String wallet) {
        if (wallet != null && !addressValidator.isValidAddress(wallet)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address"));
        }
        return ResponseEntity.ok(transactionLogService.stats(wallet != null ? wallet.trim() : null));
    }
}
