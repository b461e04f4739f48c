package com.meterpay.credit;

import com.meterpay.domain.CreditAccount;
import lombok.Getter;

/**
 * Credit ledger policy violation.
 */
@Getter
public class CreditException extends RuntimeException {

    public enum Code {
        /** Balance cannot cover the spend (also when the account does not exist). */
        INSUFFICIENT_CREDITS,
        /** Balance is short and below the account's auto top-up threshold; the payer must approve a top-up. */
        AUTO_TOPUP_REQUIRED,
        ACCOUNT_NOT_FOUND,
        INVALID_AMOUNT
    }

    private final Code code;
    private final transient CreditAccount account;

    public CreditException(Code code, String message) {
        this(code, message, null);
    }

    public CreditException(Code code, String message, CreditAccount account) {
        super(message);
        this.code = code;
        this.account = account;
    }

    public String getErrorCode() {
        return code.name();
    }
}
