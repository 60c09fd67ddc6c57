package com.example.tracepipeline.cost;

import lombok.Value;

@Value
public class CostBatchResult {
    int total;
    int processed;
    int skipped;
    int failed;
}
