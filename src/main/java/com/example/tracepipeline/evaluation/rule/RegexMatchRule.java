package com.example.tracepipeline.evaluation.rule;

import com.google.re2j.Pattern;
import lombok.Value;

/**
 * 正则匹配（RE2 语法，线性时间），内容中任意位置匹配即通过。
 */
@Value
public class RegexMatchRule implements RuleDefinition {

    RuleTarget target;
    Pattern pattern;

    @Override
    public RuleOutcome evaluate(String content) {
        return new RuleOutcome(pattern.matcher(content).find(),
                String.format("Checked if content matches pattern '%s'", pattern.pattern()));
    }
}
