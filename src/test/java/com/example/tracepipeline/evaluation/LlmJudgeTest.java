package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.EvaluatorType;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.ScoreDataType;
import com.example.tracepipeline.model.ScoreSource;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.resilience.CircuitBreaker;
import com.example.tracepipeline.resilience.CircuitBreakerConfig;
import com.example.tracepipeline.resilience.CircuitState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmJudgeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Trace trace = Trace.builder().id("t1").projectId("p1").name("qa")
            .input("question").output("answer").build();

    private ChatCompletionClient client;
    private CircuitBreaker breaker;
    private LlmJudge judge;

    @BeforeEach
    void setUp() {
        client = mock(ChatCompletionClient.class);
        when(client.isConfigured()).thenReturn(true);
        breaker = new CircuitBreaker(CircuitBreakerConfig.builder()
                .name("llm-judge")
                .maxFailures(2)
                .recordFailure(LlmJudge::countsAgainstBreaker)
                .build(), Clock.systemUTC());
        judge = new LlmJudge(client, breaker, new PromptTemplateRenderer(), new JudgeResponseParser(objectMapper),
                objectMapper, "gpt-4o-mini");
    }

    private Evaluator evaluator(ScoreDataType dataType, String config) {
        return Evaluator.builder()
                .id("ev1")
                .projectId("p1")
                .type(EvaluatorType.LLM)
                .promptTemplate("Rate this answer: {{trace_output}}")
                .config(config)
                .scoreName("quality")
                .scoreDataType(dataType)
                .build();
    }

    @Test
    void testNumericScore() throws Exception {
        when(client.complete(eq("gpt-4o-mini"), anyString(), eq("Rate this answer: answer"), any()))
                .thenReturn("{\"score\":0.72,\"reasoning\":\"fine\"}");

        Score score = judge.judge(evaluator(ScoreDataType.NUMERIC, null), trace, null, Duration.ofSeconds(30));

        assertThat(score.getValue()).isEqualTo(0.72);
        assertThat(score.getDataType()).isEqualTo(ScoreDataType.NUMERIC);
        assertThat(score.getSource()).isEqualTo(ScoreSource.EVAL);
        assertThat(score.getConfigId()).isEqualTo("ev1");
        assertThat(score.getComment()).isEqualTo("fine");
        assertThat(score.getTraceId()).isEqualTo("t1");
        assertThat(score.getObservationId()).isNull();
    }

    @Test
    void testBooleanPrefersPassedField() throws Exception {
        when(client.complete(anyString(), anyString(), anyString(), any()))
                .thenReturn("{\"passed\":false,\"score\":0.9}")
                .thenReturn("{\"score\":0.6}");

        Score first = judge.judge(evaluator(ScoreDataType.BOOLEAN, null), trace, null, Duration.ofSeconds(30));
        Score second = judge.judge(evaluator(ScoreDataType.BOOLEAN, null), trace, null, Duration.ofSeconds(30));

        assertThat(first.getValue()).isEqualTo(0.0);
        assertThat(second.getValue()).isEqualTo(1.0);
    }

    @Test
    void testCategoricalRequiresStringValue() throws Exception {
        when(client.complete(anyString(), anyString(), anyString(), any()))
                .thenReturn("{\"string_value\":\"positive\",\"score\":0.9}")
                .thenReturn("{\"score\":0.9}");

        Score score = judge.judge(evaluator(ScoreDataType.CATEGORICAL, null), trace, null, Duration.ofSeconds(30));
        assertThat(score.getStringValue()).isEqualTo("positive");
        assertThat(score.getValue()).isNull();

        assertThatThrownBy(() -> judge.judge(evaluator(ScoreDataType.CATEGORICAL, null), trace, null,
                Duration.ofSeconds(30)))
                .isInstanceOf(LlmResponseParseException.class);
    }

    @Test
    void testModelFromConfig() throws Exception {
        when(client.complete(eq("gpt-4o"), anyString(), anyString(), any())).thenReturn("{\"score\":1}");

        judge.judge(evaluator(ScoreDataType.NUMERIC, "{\"model\":\"gpt-4o\"}"), trace, null, Duration.ofSeconds(30));

        verify(client).complete(eq("gpt-4o"), anyString(), anyString(), any());
    }

    @Test
    void testMissingApiKey() throws Exception {
        when(client.isConfigured()).thenReturn(false);

        assertThatThrownBy(() -> judge.judge(evaluator(ScoreDataType.NUMERIC, null), trace, null,
                Duration.ofSeconds(30)))
                .isInstanceOf(EvaluatorConfigException.class)
                .hasMessageContaining("API key not configured");
        verify(client, never()).complete(anyString(), anyString(), anyString(), any());
    }

    @Test
    void testEmptyTemplate() {
        Evaluator evaluator = evaluator(ScoreDataType.NUMERIC, null);
        evaluator.setPromptTemplate("");

        assertThatThrownBy(() -> judge.judge(evaluator, trace, null, Duration.ofSeconds(30)))
                .isInstanceOf(EvaluatorConfigException.class);
    }

    @Test
    void testClientErrorIsNonRetryableAndDoesNotTripBreaker() throws Exception {
        when(client.complete(anyString(), anyString(), anyString(), any()))
                .thenThrow(new LlmApiException("API client error (status 400): bad", 400, false));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> judge.judge(evaluator(ScoreDataType.NUMERIC, null), trace, null,
                    Duration.ofSeconds(30)))
                    .isInstanceOf(NonRetryableJobException.class)
                    .hasMessageContaining("LLM call rejected");
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailures()).isZero();
    }

    @Test
    void testServerErrorsOpenBreaker() throws Exception {
        when(client.complete(anyString(), anyString(), anyString(), any()))
                .thenThrow(new LlmApiException("API error (status 503): down", 503, true));

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> judge.judge(evaluator(ScoreDataType.NUMERIC, null), trace, null,
                    Duration.ofSeconds(30)))
                    .isInstanceOf(LlmApiException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }
}
