package com.meterpay.ledger;

/**
 * Transport or protocol failure talking to one RPC endpoint (HTTP error, timeout, JSON-RPC error,
 * unparseable body). The failover pool retries these on the next endpoint.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
