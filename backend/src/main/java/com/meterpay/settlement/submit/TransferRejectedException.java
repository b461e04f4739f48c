package com.meterpay.settlement.submit;

/**
 * The payer declined to sign a transfer.
 */
public class TransferRejectedException extends RuntimeException {

    public TransferRejectedException(String message) {
        super(message);
    }
}
