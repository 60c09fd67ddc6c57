package com.example.tracepipeline.cost;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CostBreakdown {
    BigDecimal inputCost;
    BigDecimal outputCost;
    BigDecimal totalCost;
}
