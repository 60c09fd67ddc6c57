package com.example.tracepipeline.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * 熔断器。所有调用同一依赖的线程共享同一个实例，状态变更在实例锁内完成。
 * <p>
 * CLOSED 连续失败达到 maxFailures 后进入 OPEN；OPEN 持续 timeout 后的第一个调用进入 HALF_OPEN 作为试探；
 * HALF_OPEN 试探成功 maxHalfOpenRequests 次后恢复 CLOSED，任一试探失败回到 OPEN。
 * </p>
 */
@Slf4j
public class CircuitBreaker {

    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private int successes;
    private int halfOpenRequests;
    private Instant lastFailureTime = Instant.EPOCH;

    public CircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        CircuitBreakerConfig.CircuitBreakerConfigBuilder normalized = config.toBuilder();
        if (config.getMaxFailures() <= 0) {
            normalized.maxFailures(5);
        }
        if (config.getTimeout() == null || config.getTimeout().isZero() || config.getTimeout().isNegative()) {
            normalized.timeout(Duration.ofSeconds(30));
        }
        if (config.getMaxHalfOpenRequests() <= 0) {
            normalized.maxHalfOpenRequests(1);
        }
        this.config = normalized.build();
        this.clock = clock;
    }

    public String getName() {
        return config.getName();
    }

    /**
     * 在熔断保护下执行调用。
     *
     * @param call 下游调用
     * @return 调用结果
     * @throws CircuitBreakerOpenException 熔断器拒绝，call 未执行
     * @throws Exception                   call 本身抛出的异常
     */
    public <T> T execute(Callable<T> call) throws Exception {
        beforeRequest();
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            afterFailure(e);
            throw e;
        }
        afterSuccess();
        return result;
    }

    private void beforeRequest() {
        Transition transition = null;
        synchronized (this) {
            switch (state) {
                case OPEN:
                    if (Duration.between(lastFailureTime, clock.instant()).compareTo(config.getTimeout()) < 0) {
                        throw new CircuitBreakerOpenException(config.getName(), CircuitState.OPEN);
                    }
                    transition = transitionTo(CircuitState.HALF_OPEN);
                    halfOpenRequests++;
                    break;
                case HALF_OPEN:
                    if (halfOpenRequests >= config.getMaxHalfOpenRequests()) {
                        throw new CircuitBreakerOpenException(config.getName(), CircuitState.HALF_OPEN);
                    }
                    halfOpenRequests++;
                    break;
                default:
                    break;
            }
        }
        notifyListener(transition);
    }

    private void afterSuccess() {
        Transition transition = null;
        synchronized (this) {
            if (state == CircuitState.CLOSED) {
                failures = 0;
            } else if (state == CircuitState.HALF_OPEN) {
                successes++;
                if (successes >= config.getMaxHalfOpenRequests()) {
                    transition = transitionTo(CircuitState.CLOSED);
                }
            }
        }
        notifyListener(transition);
    }

    private void afterFailure(Throwable error) {
        Transition transition = null;
        synchronized (this) {
            if (!config.getRecordFailure().test(error)) {
                // 不计入失败的异常只归还试探名额
                if (state == CircuitState.HALF_OPEN && halfOpenRequests > 0) {
                    halfOpenRequests--;
                }
                return;
            }
            failures++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.CLOSED && failures >= config.getMaxFailures()) {
                transition = transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.HALF_OPEN) {
                transition = transitionTo(CircuitState.OPEN);
            }
        }
        notifyListener(transition);
    }

    /**
     * 强制恢复 CLOSED。
     */
    public void reset() {
        Transition transition;
        synchronized (this) {
            transition = transitionTo(CircuitState.CLOSED);
        }
        notifyListener(transition);
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailures() {
        return failures;
    }

    public CircuitBreakerStats stats() {
        synchronized (this) {
            return new CircuitBreakerStats(config.getName(), state.getLabel(), failures);
        }
    }

    private Transition transitionTo(CircuitState next) {
        if (state == next) {
            return null;
        }
        CircuitState previous = state;
        state = next;
        switch (next) {
            case CLOSED:
                failures = 0;
                successes = 0;
                halfOpenRequests = 0;
                break;
            case OPEN:
            case HALF_OPEN:
                successes = 0;
                halfOpenRequests = 0;
                break;
            default:
                break;
        }
        return new Transition(previous, next);
    }

    private void notifyListener(Transition transition) {
        if (transition == null || config.getListener() == null) {
            return;
        }
        try {
            config.getListener().onStateChange(config.getName(), transition.from, transition.to);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed for '{}': {}", config.getName(), e.getMessage());
        }
    }

    private static final class Transition {
        private final CircuitState from;
        private final CircuitState to;

        private Transition(CircuitState from, CircuitState to) {
            this.from = from;
            this.to = to;
        }
    }
}
