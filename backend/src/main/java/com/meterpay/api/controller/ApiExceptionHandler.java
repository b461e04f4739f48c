package com.meterpay.api.controller;

import com.meterpay.api.dto.ErrorBody;
import com.meterpay.api.dto.PaymentRequiredBody;
import com.meterpay.credit.CreditException;
import com.meterpay.ledger.EndpointPoolExhaustedException;
import com.meterpay.ledger.RpcException;
import com.meterpay.protocol.InvalidPaymentHeaderException;
import com.meterpay.protocol.PaymentGateException;
import com.meterpay.protocol.PaymentHeaderCodec;
import com.meterpay.protocol.PaymentRequiredException;
import com.meterpay.session.SessionException;
import com.meterpay.settlement.submit.PaymentFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.Instant;
import java.util.Optional;

/**
 * Maps validation failures and domain exceptions to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is invalid")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(PaymentRequiredException.class)
    public ResponseEntity<PaymentRequiredBody> handlePaymentRequired(PaymentRequiredException ex) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .header("X-402-Required-Amount", ex.getRequiredAmount().toPlainString())
                .body(new PaymentRequiredBody("PAYMENT_REQUIRED", ex.getMessage(), ex.getRequiredAmount(),
                        ex.getCurrency(), ex.getRecipient(), ex.getResourcePattern(),
                        PaymentHeaderCodec.HEADER_NAME, Instant.now()));
    }

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<ErrorBody> handleSession(SessionException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_EXPIRED, SESSION_REVOKED, SESSION_DEPLETED -> HttpStatus.CONFLICT;
            case INSUFFICIENT_SESSION_BALANCE -> HttpStatus.PAYMENT_REQUIRED;
            case RESOURCE_MISMATCH -> HttpStatus.FORBIDDEN;
            case INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(CreditException.class)
    public ResponseEntity<ErrorBody> handleCredit(CreditException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case INSUFFICIENT_CREDITS, AUTO_TOPUP_REQUIRED -> HttpStatus.PAYMENT_REQUIRED;
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(PaymentGateException.class)
    public ResponseEntity<ErrorBody> handleGate(PaymentGateException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case SERVICE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SERVICE_INACTIVE, PAYMENTS_NOT_ACCEPTED -> HttpStatus.FORBIDDEN;
            case PROOF_REUSED -> HttpStatus.CONFLICT;
            case PROOF_NOT_FOUND, PROOF_FAILED, WRONG_PAYER, WRONG_RECIPIENT, UNDERPAID -> HttpStatus.PAYMENT_REQUIRED;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(PaymentFailedException.class)
    public ResponseEntity<ErrorBody> handlePaymentFailed(PaymentFailedException ex) {
        HttpStatus status = ex.getReason() == PaymentFailedException.Reason.NETWORK
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.PAYMENT_REQUIRED;
        log.warn("Payment failed ({}): {}", ex.getReason(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler({EndpointPoolExhaustedException.class, RpcException.class})
    public ResponseEntity<ErrorBody> handleNetwork(RuntimeException ex) {
        log.warn("Settlement network unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("NETWORK_UNAVAILABLE", "Settlement network is unavailable, retry later"));
    }

    @ExceptionHandler(InvalidPaymentHeaderException.class)
    public ResponseEntity<ErrorBody> handleInvalidHeader(InvalidPaymentHeaderException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PAYMENT_HEADER", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
