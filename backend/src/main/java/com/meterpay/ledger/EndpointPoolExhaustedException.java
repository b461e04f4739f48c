package com.meterpay.ledger;

import lombok.Getter;

import java.util.List;

/**
 * Every endpoint in the pool failed for one operation. Carries the per-attempt failures in order.
 */
@Getter
public class EndpointPoolExhaustedException extends RuntimeException {

    private final String operation;
    private final List<RpcException> attemptFailures;

    public EndpointPoolExhaustedException(String operation, List<RpcException> attemptFailures) {
        super("All " + attemptFailures.size() + " RPC attempts failed for " + operation + lastMessage(attemptFailures));
        this.operation = operation;
        this.attemptFailures = List.copyOf(attemptFailures);
        attemptFailures.forEach(this::addSuppressed);
    }

    private static String lastMessage(List<RpcException> failures) {
        return failures.isEmpty() ? "" : ": " + failures.get(failures.size() - 1).getMessage();
    }
}
