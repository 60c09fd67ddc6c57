package com.example.tracepipeline.config;

import com.example.tracepipeline.evaluation.ChatCompletionClient;
import com.example.tracepipeline.evaluation.JudgeResponseParser;
import com.example.tracepipeline.evaluation.LlmJudge;
import com.example.tracepipeline.evaluation.PromptTemplateRenderer;
import com.example.tracepipeline.resilience.CircuitBreaker;
import com.example.tracepipeline.resilience.CircuitBreakerConfig;
import com.example.tracepipeline.resilience.CircuitBreakerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * LLM 评估与 Webhook 投递用到的 HTTP 客户端和熔断器。
 */
@Configuration
public class EvaluationConfig {

    static final String LLM_BREAKER = "llm-judge";

    @Bean(name = "llmHttpClient")
    public HttpClient llmHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * 不跟随重定向，避免绕过 SSRF 校验
     */
    @Bean(name = "webhookHttpClient")
    public HttpClient webhookHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public ChatCompletionClient chatCompletionClient(
            @Qualifier("llmHttpClient") HttpClient httpClient,
            ObjectMapper objectMapper,
            @Value("${app.evaluation.llm.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${app.evaluation.llm.api-key:}") String apiKey,
            @Value("${app.evaluation.llm.request-timeout:60s}") Duration requestTimeout) {
        return new ChatCompletionClient(httpClient, objectMapper, baseUrl, apiKey, requestTimeout);
    }

    @Bean
    public LlmJudge llmJudge(ChatCompletionClient client,
                             CircuitBreakerRegistry breakerRegistry,
                             PromptTemplateRenderer renderer,
                             JudgeResponseParser parser,
                             ObjectMapper objectMapper,
                             @Value("${app.evaluation.llm.default-model:gpt-4o-mini}") String defaultModel) {
        CircuitBreaker breaker = breakerRegistry.get(LLM_BREAKER, () -> CircuitBreakerConfig.builder()
                .name(LLM_BREAKER)
                .maxFailures(5)
                .timeout(Duration.ofSeconds(30))
                .maxHalfOpenRequests(1)
                .recordFailure(LlmJudge::countsAgainstBreaker)
                .build());
        return new LlmJudge(client, breaker, renderer, parser, objectMapper, defaultModel);
    }
}
