package com.meterpay.protocol;

public class InvalidPaymentHeaderException extends IllegalArgumentException {

    public InvalidPaymentHeaderException(String message) {
        super(message);
    }
}
