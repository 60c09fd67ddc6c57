package com.example.tracepipeline.resilience;

import lombok.Getter;

/**
 * 熔断器拒绝调用：处于 OPEN 状态，或 HALF_OPEN 时试探名额已满。下游函数未被调用。
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitState state;

    public CircuitBreakerOpenException(String breakerName, CircuitState state) {
        super(state == CircuitState.OPEN
                ? "Circuit breaker '" + breakerName + "' is open"
                : "Too many requests, circuit breaker '" + breakerName + "' is half-open");
        this.breakerName = breakerName;
        this.state = state;
    }
}
