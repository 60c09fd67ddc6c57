package com.example.tracepipeline.evaluation.rule;

/**
 * 已校验的规则。由 {@link RuleConfigParser} 在加载评估器时从 JSON 配置解析得到。
 */
public sealed interface RuleDefinition permits ContainsRule, NotContainsRule, LengthCheckRule, RegexMatchRule {

    RuleTarget getTarget();

    /**
     * 对目标内容求值。
     *
     * @param content 目标内容，不为 null
     * @return 结果与说明
     */
    RuleOutcome evaluate(String content);
}
