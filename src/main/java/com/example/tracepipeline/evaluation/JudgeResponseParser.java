package com.example.tracepipeline.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 解析评审模型的 JSON 回复。直接解析失败时，退而截取第一个 '{' 到最后一个 '}' 之间的内容再解析。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JudgeResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * @param response 模型回复文本
     * @return 结论
     * @throws LlmResponseParseException 回复中没有可用的 JSON 对象
     */
    public JudgeVerdict parse(String response) {
        if (response == null) {
            throw new LlmResponseParseException("empty response from LLM");
        }
        JsonNode root = readObject(response);
        if (root == null) {
            int start = response.indexOf('{');
            int end = response.lastIndexOf('}');
            if (start < 0 || end <= start) {
                throw new LlmResponseParseException("no JSON found in response");
            }
            root = readObject(response.substring(start, end + 1));
            if (root == null) {
                throw new LlmResponseParseException("invalid JSON in response");
            }
        }

        double score = 0.0;
        JsonNode scoreNode = root.get("score");
        if (scoreNode != null && !scoreNode.isNull()) {
            if (!scoreNode.isNumber()) {
                throw new LlmResponseParseException("'score' must be a number");
            }
            score = clamp(scoreNode.asDouble());
        }

        JsonNode passedNode = root.get("passed");
        Boolean passed = passedNode != null && passedNode.isBoolean() ? passedNode.asBoolean() : null;

        return new JudgeVerdict(score, text(root, "string_value"), text(root, "reasoning"), passed);
    }

    private JsonNode readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("LLM response is not plain JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    static double clamp(double score) {
        if (Double.isNaN(score) || score < 0.0) {
            return 0.0;
        }
        return Math.min(score, 1.0);
    }
}
