package com.meterpay.session;

import lombok.Getter;

/**
 * Session policy violation. The API layer maps codes to 404 / 409 / 402 / 403 / 400.
 */
@Getter
public class SessionException extends RuntimeException {

    public enum Code {
        SESSION_NOT_FOUND,
        SESSION_EXPIRED,
        SESSION_REVOKED,
        SESSION_DEPLETED,
        INSUFFICIENT_SESSION_BALANCE,
        RESOURCE_MISMATCH,
        INVALID_AMOUNT
    }

    private final Code code;

    public SessionException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public String getErrorCode() {
        return code.name();
    }
}
