package com.example.tracepipeline.evaluation.rule;

import lombok.Value;

@Value
public class ContainsRule implements RuleDefinition {

    RuleTarget target;
    String substring;

    @Override
    public RuleOutcome evaluate(String content) {
        return new RuleOutcome(content.contains(substring),
                String.format("Checked if content contains '%s'", substring));
    }
}
