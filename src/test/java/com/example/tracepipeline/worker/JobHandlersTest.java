package com.example.tracepipeline.worker;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.evaluation.EvaluationService;
import com.example.tracepipeline.evaluation.LlmJudge;
import com.example.tracepipeline.evaluation.RuleEvaluator;
import com.example.tracepipeline.evaluation.rule.RuleConfigParser;
import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.EvaluatorType;
import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.ScoreDataType;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.notification.NotificationDispatcher;
import com.example.tracepipeline.queue.Job;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.repository.EvaluatorRepository;
import com.example.tracepipeline.repository.ObservationRepository;
import com.example.tracepipeline.repository.ScoreRepository;
import com.example.tracepipeline.repository.TraceRepository;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobHandlersTest {

    private static final Instant NOW = Instant.parse("2024-03-15T08:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final ObjectMapper objectMapper = new ObjectMapper();

    private JobContext context(JobType type, String payload, int retried) {
        Job job = Job.builder().id("j1").type(type).payload(payload).retried(retried).build();
        return new JobContext(job, NOW.plusSeconds(20), clock, objectMapper);
    }

    @Test
    void testCostCalculationReadsSnakeCasePayload() {
        CostAttributionService service = mock(CostAttributionService.class);
        CostCalculationHandler handler = new CostCalculationHandler(service);

        handler.handle(context(JobType.COST_CALCULATION, "{\"project_id\":\"p1\",\"trace_id\":\"t1\","
                + "\"observation_id\":\"o1\",\"model\":\"gpt-4o\",\"prompt_tokens\":120,\"completion_tokens\":30}", 0));

        verify(service).calculate("p1", "t1", "o1", "gpt-4o", 120, 30);
    }

    @Test
    void testCostCalculationMissingModel() {
        CostAttributionService service = mock(CostAttributionService.class);
        CostCalculationHandler handler = new CostCalculationHandler(service);

        assertThatThrownBy(() -> handler.handle(context(JobType.COST_CALCULATION,
                "{\"project_id\":\"p1\",\"observation_id\":\"o1\"}", 0)))
                .isInstanceOf(NonRetryableJobException.class)
                .hasMessage("model is required");
        verifyNoInteractions(service);
    }

    @Test
    void testDailyAggregationDefaultsToYesterday() {
        CostAttributionService service = mock(CostAttributionService.class);
        DailyCostAggregationHandler handler = new DailyCostAggregationHandler(service, clock);

        handler.handle(context(JobType.DAILY_COST_AGGREGATION, "{}", 0));

        verify(service).aggregateDaily(null, LocalDate.of(2024, 3, 14));
    }

    @Test
    void testEvaluationPassesRemainingBudget() throws Exception {
        EvaluationService service = mock(EvaluationService.class);
        when(service.evaluate(any(), any(), any(), any(), any())).thenReturn(Optional.empty());
        EvaluationHandler handler = new EvaluationHandler(service);
        clock.advance(Duration.ofSeconds(5));

        handler.handle(context(JobType.EVALUATION,
                "{\"project_id\":\"p1\",\"evaluator_id\":\"ev1\",\"trace_id\":\"t1\"}", 0));

        verify(service).evaluate("p1", "ev1", "t1", null, Duration.ofSeconds(15));
    }

    @Test
    void testRedeliveredEvaluationCreatesSecondScore() throws Exception {
        EvaluatorRepository evaluatorRepository = mock(EvaluatorRepository.class);
        TraceRepository traceRepository = mock(TraceRepository.class);
        ScoreRepository scoreRepository = mock(ScoreRepository.class);
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(Evaluator.builder()
                .id("ev1").projectId("p1").type(EvaluatorType.RULE).scoreName("has-answer")
                .scoreDataType(ScoreDataType.BOOLEAN)
                .config("{\"rule_type\":\"contains\",\"target\":\"trace_output\",\"substring\":\"answer\"}")
                .build()));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.of(
                Trace.builder().id("t1").projectId("p1").output("the answer is 42").build()));
        when(scoreRepository.save(any(Score.class))).thenAnswer(inv -> inv.getArgument(0));
        EvaluationService service = new EvaluationService(evaluatorRepository, traceRepository,
                mock(ObservationRepository.class), scoreRepository,
                new RuleEvaluator(new RuleConfigParser(objectMapper)), mock(LlmJudge.class));
        EvaluationHandler handler = new EvaluationHandler(service);
        String payload = "{\"project_id\":\"p1\",\"evaluator_id\":\"ev1\",\"trace_id\":\"t1\"}";

        // 至少一次投递：同一任务处理两次
        handler.handle(context(JobType.EVALUATION, payload, 0));
        handler.handle(context(JobType.EVALUATION, payload, 1));

        ArgumentCaptor<Score> saved = ArgumentCaptor.forClass(Score.class);
        verify(scoreRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).hasSize(2);
        assertThat(saved.getAllValues().get(0)).isNotSameAs(saved.getAllValues().get(1));
        assertThat(saved.getAllValues()).allSatisfy(score -> assertThat(score.getValue()).isEqualTo(1.0));
    }

    @Test
    void testNotificationSendPassesRetryCount() throws Exception {
        WebhookRepository repository = mock(WebhookRepository.class);
        NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
        Webhook webhook = Webhook.builder().id("wh1").projectId("p1").build();
        when(repository.findById("wh1")).thenReturn(Optional.of(webhook));
        NotificationSendHandler handler = new NotificationSendHandler(repository, dispatcher);

        handler.handle(context(JobType.NOTIFICATION_SEND,
                "{\"webhookId\":\"wh1\",\"eventType\":\"trace.error\",\"data\":{\"traceId\":\"t1\"}}", 3));

        verify(dispatcher).send(webhook, EventType.TRACE_ERROR, Map.of("traceId", "t1"), 3, Duration.ofSeconds(20));
    }

    @Test
    void testNotificationSendUnknownWebhook() throws Exception {
        WebhookRepository repository = mock(WebhookRepository.class);
        NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
        when(repository.findById("gone")).thenReturn(Optional.empty());
        NotificationSendHandler handler = new NotificationSendHandler(repository, dispatcher);

        assertThatThrownBy(() -> handler.handle(context(JobType.NOTIFICATION_SEND,
                "{\"webhookId\":\"gone\",\"eventType\":\"trace.error\"}", 0)))
                .isInstanceOf(NonRetryableJobException.class)
                .hasMessage("webhook not found: gone");
        verify(dispatcher, never()).send(any(), any(), any(), anyInt(), any());
    }

    @Test
    void testNotificationSendUnknownEventType() {
        NotificationSendHandler handler = new NotificationSendHandler(mock(WebhookRepository.class),
                mock(NotificationDispatcher.class));

        assertThatThrownBy(() -> handler.handle(context(JobType.NOTIFICATION_SEND,
                "{\"webhookId\":\"wh1\",\"eventType\":\"trace.unknown\"}", 0)))
                .isInstanceOf(NonRetryableJobException.class);
        assertThatThrownBy(() -> handler.handle(context(JobType.NOTIFICATION_SEND,
                "{\"webhookId\":\"wh1\"}", 0)))
                .isInstanceOf(NonRetryableJobException.class)
                .hasMessage("eventType is required");
    }
}
