package com.example.tracepipeline.resilience;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按名称共享熔断器实例（LLM 供应商一个，每个 Webhook 主机一个）。
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public CircuitBreakerRegistry(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 获取熔断器，不存在时按给定配置创建。未设置监听器时使用日志监听器。
     *
     * @param name   名称
     * @param config 创建时使用的配置
     * @return 熔断器
     */
    public CircuitBreaker get(String name, Supplier<CircuitBreakerConfig> config) {
        return breakers.computeIfAbsent(name, key -> create(key, config.get()));
    }

    public CircuitBreaker get(String name) {
        return get(name, () -> CircuitBreakerConfig.defaults(name));
    }

    public List<CircuitBreakerStats> stats() {
        List<CircuitBreakerStats> stats = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            stats.add(breaker.stats());
        }
        stats.sort(Comparator.comparing(CircuitBreakerStats::getName));
        return stats;
    }

    private CircuitBreaker create(String name, CircuitBreakerConfig config) {
        CircuitBreakerConfig.CircuitBreakerConfigBuilder builder = config.toBuilder().name(name);
        if (config.getListener() == null) {
            builder.listener(CircuitBreakerRegistry::logStateChange);
        }
        CircuitBreaker breaker = new CircuitBreaker(builder.build(), clock);
        Gauge.builder("pipeline.circuit_breaker.state", breaker, b -> b.getState().ordinal())
                .tag("name", name)
                .description("0=closed, 1=open, 2=half-open")
                .register(meterRegistry);
        log.info("Created circuit breaker '{}'", name);
        return breaker;
    }

    private static void logStateChange(String name, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit breaker '{}' opened ({} -> {})", name, from.getLabel(), to.getLabel());
        } else {
            log.info("Circuit breaker '{}' state changed: {} -> {}", name, from.getLabel(), to.getLabel());
        }
    }
}
