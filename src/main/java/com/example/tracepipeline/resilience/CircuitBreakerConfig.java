package com.example.tracepipeline.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 熔断器配置。默认 5 次连续失败熔断，30 秒后半开，半开时放行 1 个试探请求。
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    String name;

    @Builder.Default
    int maxFailures = 5;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxHalfOpenRequests = 1;

    /**
     * 哪些异常计入失败。不计入的异常直接抛给调用方，计数不变。
     */
    @Builder.Default
    Predicate<Throwable> recordFailure = e -> true;

    CircuitBreakerListener listener;

    public static CircuitBreakerConfig defaults(String name) {
        return CircuitBreakerConfig.builder().name(name).build();
    }
}
