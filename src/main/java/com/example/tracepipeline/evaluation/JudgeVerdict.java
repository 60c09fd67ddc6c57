package com.example.tracepipeline.evaluation;

import lombok.Value;

/**
 * 评审模型返回的结论，score 已截断到 [0, 1]。
 */
@Value
public class JudgeVerdict {
    double score;
    String stringValue;
    String reasoning;
    Boolean passed;
}
