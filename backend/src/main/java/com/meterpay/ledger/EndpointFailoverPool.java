package com.meterpay.ledger;

import com.meterpay.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Ordered RPC endpoint list with a sticky preferred endpoint. An operation starts on the preferred
 * endpoint and moves to the next one (wrapping) on {@link RpcException}, at most once per endpoint.
 * The endpoint that succeeds becomes preferred. The pointer is shared process-wide, last writer wins.
 */
@Slf4j
public class EndpointFailoverPool {

    private final List<String> endpoints;
    private final AtomicInteger preferred;
    private final RetryPolicy retryPolicy;

    public EndpointFailoverPool(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.preferred = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    /**
     * Runs the operation with failover. Exceptions other than {@link RpcException} are not retried
     * and propagate unchanged.
     *
     * @throws EndpointPoolExhaustedException when every endpoint failed
     */
    public <T> T execute(String operationName, Function<String, T> operation) {
        int size = endpoints.size();
        int start = preferred.get();
        List<RpcException> failures = new ArrayList<>(size);
        for (int attempt = 0; attempt < size; attempt++) {
            int index = (start + attempt) % size;
            String endpoint = endpoints.get(index);
            try {
                T result = operation.apply(endpoint);
                if (index != start) {
                    log.info("RPC {} succeeded on fallback endpoint {}, now preferred", operationName, endpoint);
                }
                preferred.set(index);
                return result;
            } catch (RpcException e) {
                failures.add(e);
                log.warn("RPC {} failed on {} (attempt {}/{}): {}", operationName, endpoint, attempt + 1, size, e.getMessage());
                if (attempt < size - 1 && !pause(attempt)) {
                    break;
                }
            }
        }
        throw new EndpointPoolExhaustedException(operationName, failures);
    }

    private boolean pause(int attempt) {
        long delay = retryPolicy.delayMs(attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String preferredEndpoint() {
        return endpoints.get(preferred.get());
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public int size() {
        return endpoints.size();
    }
}
