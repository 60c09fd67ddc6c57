package com.example.tracepipeline.evaluation.rule;

import lombok.Value;

@Value
public class RuleOutcome {
    boolean passed;
    String comment;
}
