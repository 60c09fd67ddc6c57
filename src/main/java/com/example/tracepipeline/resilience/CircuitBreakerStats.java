package com.example.tracepipeline.resilience;

import lombok.Value;

@Value
public class CircuitBreakerStats {
    String name;
    String state;
    int failures;
}
