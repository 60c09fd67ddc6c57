package com.example.tracepipeline.evaluation;

import lombok.Value;

@Value
public class BatchEvaluationResult {
    int total;
    int succeeded;
    int failed;
}
