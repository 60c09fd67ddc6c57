package com.example.tracepipeline.queue;

import java.time.Duration;

/**
 * 指数退避：initial × multiplier^retried，不超过 max。
 */
public class RetryBackoff {

    private final Duration initial;
    private final double multiplier;
    private final Duration max;

    public RetryBackoff(Duration initial, double multiplier, Duration max) {
        this.initial = initial;
        this.multiplier = multiplier;
        this.max = max;
    }

    public Duration delayFor(int retried) {
        double millis = initial.toMillis() * Math.pow(multiplier, Math.max(retried, 0));
        if (millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }
}
