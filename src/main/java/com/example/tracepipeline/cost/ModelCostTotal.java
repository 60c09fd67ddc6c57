package com.example.tracepipeline.cost;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ModelCostTotal {
    String model;
    BigDecimal cost;
    long observationCount;
    long inputTokens;
    long outputTokens;
}
