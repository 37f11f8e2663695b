package com.tradingcore.risk;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of one rule's circuit breaker. {@code failureCount} is the number of failures still
 * inside the sliding window.
 */
@Value
@Builder
public class CircuitBreakerState {

    CircuitBreaker.State state;
    int failureCount;

    public boolean isOpen() {
        return state == CircuitBreaker.State.OPEN;
    }
}
