package com.example.tracepipeline.evaluation.rule;

import lombok.Value;

@Value
public class NotContainsRule implements RuleDefinition {

    RuleTarget target;
    String substring;

    @Override
    public RuleOutcome evaluate(String content) {
        return new RuleOutcome(!content.contains(substring),
                String.format("Checked if content does not contain '%s'", substring));
    }
}
