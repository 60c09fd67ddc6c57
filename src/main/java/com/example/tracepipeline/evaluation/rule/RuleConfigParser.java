package com.example.tracepipeline.evaluation.rule;

import com.example.tracepipeline.evaluation.EvaluatorConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 将评估器的 JSON 规则配置解析为 {@link RuleDefinition}。
 * 任何缺失、类型错误或未知取值都抛出 {@link EvaluatorConfigException}。
 */
@Component
@RequiredArgsConstructor
public class RuleConfigParser {

    private final ObjectMapper objectMapper;

    public RuleDefinition parse(String config) {
        if (config == null || config.isBlank()) {
            throw new EvaluatorConfigException("evaluator config is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(config);
        } catch (JsonProcessingException e) {
            throw new EvaluatorConfigException("invalid evaluator config: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EvaluatorConfigException("evaluator config must be a JSON object");
        }

        JsonNode ruleTypeNode = root.get("rule_type");
        if (ruleTypeNode == null || !ruleTypeNode.isTextual() || ruleTypeNode.asText().isEmpty()) {
            throw new EvaluatorConfigException("rule_type is required and must be a string");
        }
        String ruleType = ruleTypeNode.asText();

        switch (ruleType) {
            case "contains":
                return new ContainsRule(target(root, ruleType), requiredString(root, "substring", ruleType));
            case "not_contains":
                return new NotContainsRule(target(root, ruleType), requiredString(root, "substring", ruleType));
            case "length_check":
                return new LengthCheckRule(target(root, ruleType),
                        optionalLength(root, "min_length", ruleType),
                        optionalLength(root, "max_length", ruleType));
            case "regex_match":
                RuleTarget target = target(root, ruleType);
                String pattern = requiredString(root, "pattern", ruleType);
                try {
                    return new RegexMatchRule(target, Pattern.compile(pattern));
                } catch (PatternSyntaxException e) {
                    throw new EvaluatorConfigException("invalid pattern for rule type 'regex_match': "
                            + e.getMessage(), e);
                }
            default:
                throw new EvaluatorConfigException("unsupported rule type: " + ruleType);
        }
    }

    private RuleTarget target(JsonNode root, String ruleType) {
        String key = requiredString(root, "target", ruleType);
        RuleTarget target = RuleTarget.fromKey(key);
        if (target == null) {
            throw new EvaluatorConfigException("unknown target '" + key + "' for rule type '" + ruleType + "'");
        }
        return target;
    }

    private String requiredString(JsonNode root, String field, String ruleType) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new EvaluatorConfigException("'" + field + "' must be a string for rule type '" + ruleType + "'");
        }
        return node.asText();
    }

    private int optionalLength(JsonNode root, String field, String ruleType) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return 0;
        }
        // 1.0 这类整值浮点可接受；小数或超出 int 范围的值不做截断
        boolean integral = node.isIntegralNumber()
                || (node.isFloatingPointNumber() && node.asDouble() == Math.rint(node.asDouble()));
        if (!node.isNumber() || !integral || !node.canConvertToInt() || node.asInt() < 0) {
            throw new EvaluatorConfigException("'" + field + "' must be a non-negative integer for rule type '"
                    + ruleType + "'");
        }
        return node.asInt();
    }
}
