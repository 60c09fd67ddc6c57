package com.example.tracepipeline.resilience;

/**
 * 熔断器状态变化回调，在熔断器锁之外调用。
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onStateChange(String name, CircuitState from, CircuitState to);
}
