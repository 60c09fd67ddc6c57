package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.ScoreDataType;
import com.example.tracepipeline.model.ScoreSource;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.resilience.CircuitBreaker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * LLM 评审：渲染提示词，经熔断器调用模型，解析结论并映射为分数。
 */
@Slf4j
public class LlmJudge {

    private final ChatCompletionClient client;
    private final CircuitBreaker circuitBreaker;
    private final PromptTemplateRenderer renderer;
    private final JudgeResponseParser parser;
    private final ObjectMapper objectMapper;
    private final String defaultModel;

    public LlmJudge(ChatCompletionClient client, CircuitBreaker circuitBreaker, PromptTemplateRenderer renderer,
                    JudgeResponseParser parser, ObjectMapper objectMapper, String defaultModel) {
        this.client = client;
        this.circuitBreaker = circuitBreaker;
        this.renderer = renderer;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.defaultModel = defaultModel;
    }

    /**
     * 哪些异常计入 LLM 熔断器：客户端 4xx 和任务取消不计入。
     */
    public static boolean countsAgainstBreaker(Throwable error) {
        if (error instanceof LlmApiException) {
            return ((LlmApiException) error).isServerSide();
        }
        return !(error instanceof InterruptedException);
    }

    /**
     * 运行一次 LLM 评估。
     *
     * @param evaluator   LLM 类型的评估器
     * @param trace       trace
     * @param observation 观测，可为 null
     * @param budget      剩余时间预算
     * @return 未保存的分数
     * @throws EvaluatorConfigException 未配置 API Key 或提示词模板为空
     * @throws Exception                调用或解析失败
     */
    public Score judge(Evaluator evaluator, Trace trace, Observation observation, Duration budget) throws Exception {
        if (!client.isConfigured()) {
            throw new EvaluatorConfigException("LLM API key not configured (set app.evaluation.llm.api-key)");
        }
        String template = evaluator.getPromptTemplate();
        if (template == null || template.isEmpty()) {
            throw new EvaluatorConfigException("evaluator has no prompt template");
        }

        String prompt = renderer.render(template, renderer.variables(trace, observation));
        String model = resolveModel(evaluator);
        String systemPrompt = JudgeSystemPrompts.forDataType(evaluator.getScoreDataType());

        log.info("Running LLM evaluation: evaluatorId={}, model={}, promptLength={}",
                evaluator.getId(), model, prompt.length());

        String response;
        try {
            response = circuitBreaker.execute(() -> client.complete(model, systemPrompt, prompt, budget));
        } catch (LlmApiException e) {
            if (!e.isServerSide()) {
                throw new NonRetryableJobException("LLM call rejected: " + e.getMessage(), e);
            }
            throw e;
        }

        JudgeVerdict verdict = parser.parse(response);
        Score score = toScore(evaluator, trace, observation, verdict);
        log.info("LLM evaluation completed: evaluatorId={}, score={}, reasoning={}",
                evaluator.getId(), verdict.getScore(), verdict.getReasoning());
        return score;
    }

    private String resolveModel(Evaluator evaluator) {
        String config = evaluator.getConfig();
        if (config == null || config.isBlank()) {
            return defaultModel;
        }
        try {
            JsonNode node = objectMapper.readTree(config).get("model");
            if (node != null && node.isTextual() && !node.asText().isEmpty()) {
                return node.asText();
            }
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparsable config of evaluator {}: {}", evaluator.getId(), e.getOriginalMessage());
        }
        return defaultModel;
    }

    private Score toScore(Evaluator evaluator, Trace trace, Observation observation, JudgeVerdict verdict) {
        Score score = Score.builder()
                .projectId(evaluator.getProjectId())
                .traceId(trace.getId())
                .observationId(observation != null ? observation.getId() : null)
                .name(evaluator.getScoreName())
                .dataType(evaluator.getScoreDataType())
                .source(ScoreSource.EVAL)
                .comment(verdict.getReasoning())
                .configId(evaluator.getId())
                .build();

        ScoreDataType dataType = evaluator.getScoreDataType();
        if (dataType == ScoreDataType.BOOLEAN) {
            boolean passed = verdict.getPassed() != null ? verdict.getPassed() : verdict.getScore() >= 0.5;
            score.setValue(passed ? 1.0 : 0.0);
        } else if (dataType == ScoreDataType.CATEGORICAL) {
            if (verdict.getStringValue() == null || verdict.getStringValue().isEmpty()) {
                throw new LlmResponseParseException("categorical evaluation returned no string_value");
            }
            score.setStringValue(verdict.getStringValue());
        } else {
            score.setValue(verdict.getScore());
        }
        return score;
    }
}
