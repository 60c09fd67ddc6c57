package com.example.tracepipeline.evaluation.rule;

import lombok.Value;

/**
 * 长度检查，按 Unicode 码点计数。maxLength 为 0 表示不限上限。
 */
@Value
public class LengthCheckRule implements RuleDefinition {

    RuleTarget target;
    int minLength;
    int maxLength;

    @Override
    public RuleOutcome evaluate(String content) {
        int length = content.codePointCount(0, content.length());
        boolean passed = length >= minLength && (maxLength == 0 || length <= maxLength);
        return new RuleOutcome(passed, String.format("Length: %d (min: %d, max: %d)", length, minLength, maxLength));
    }
}
