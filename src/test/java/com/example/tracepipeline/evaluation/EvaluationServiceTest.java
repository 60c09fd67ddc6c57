package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.evaluation.rule.RuleConfigParser;
import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.EvaluatorType;
import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.ScoreDataType;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.repository.EvaluatorRepository;
import com.example.tracepipeline.repository.ObservationRepository;
import com.example.tracepipeline.repository.ScoreRepository;
import com.example.tracepipeline.repository.TraceRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    @Mock
    private EvaluatorRepository evaluatorRepository;
    @Mock
    private TraceRepository traceRepository;
    @Mock
    private ObservationRepository observationRepository;
    @Mock
    private ScoreRepository scoreRepository;
    @Mock
    private LlmJudge llmJudge;

    private EvaluationService service;

    @BeforeEach
    void setUp() {
        RuleEvaluator ruleEvaluator = new RuleEvaluator(new RuleConfigParser(new ObjectMapper()));
        service = new EvaluationService(evaluatorRepository, traceRepository, observationRepository,
                scoreRepository, ruleEvaluator, llmJudge);
    }

    private static Evaluator ruleEvaluator(String config) {
        return Evaluator.builder()
                .id("ev1")
                .projectId("p1")
                .type(EvaluatorType.RULE)
                .config(config)
                .scoreName("mentions-refund")
                .scoreDataType(ScoreDataType.BOOLEAN)
                .build();
    }

    @Test
    void testRuleEvaluationSavesBooleanScore() throws Exception {
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(
                ruleEvaluator("{\"rule_type\":\"contains\",\"target\":\"trace_output\",\"substring\":\"refund\"}")));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.of(
                Trace.builder().id("t1").projectId("p1").output("Your refund is on its way").build()));
        when(scoreRepository.save(any(Score.class))).thenAnswer(inv -> inv.getArgument(0));

        Optional<Score> result = service.evaluate("p1", "ev1", "t1", null, Duration.ofSeconds(30));

        assertThat(result).isPresent();
        Score score = result.get();
        assertThat(score.getValue()).isEqualTo(1.0);
        assertThat(score.getName()).isEqualTo("mentions-refund");
        assertThat(score.getComment()).isEqualTo("Checked if content contains 'refund'");
        verifyNoInteractions(llmJudge);
    }

    @Test
    void testPresentAndMissingSubstringOnSameTrace() throws Exception {
        Evaluator important = ruleEvaluator(
                "{\"rule_type\":\"contains\",\"target\":\"trace_output\",\"substring\":\"important\"}");
        important.setId("ev-important");
        Evaluator missing = ruleEvaluator(
                "{\"rule_type\":\"contains\",\"target\":\"trace_output\",\"substring\":\"missing\"}");
        missing.setId("ev-missing");
        when(evaluatorRepository.findByIdAndProjectId("ev-important", "p1")).thenReturn(Optional.of(important));
        when(evaluatorRepository.findByIdAndProjectId("ev-missing", "p1")).thenReturn(Optional.of(missing));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.of(
                Trace.builder().id("t1").projectId("p1").output("This is an important message").build()));
        when(scoreRepository.save(any(Score.class))).thenAnswer(inv -> inv.getArgument(0));

        Score found = service.evaluate("p1", "ev-important", "t1", null, Duration.ofSeconds(30)).orElseThrow();
        Score notFound = service.evaluate("p1", "ev-missing", "t1", null, Duration.ofSeconds(30)).orElseThrow();

        assertThat(found.getValue()).isEqualTo(1.0);
        assertThat(found.getConfigId()).isEqualTo("ev-important");
        assertThat(notFound.getValue()).isEqualTo(0.0);
        assertThat(notFound.getConfigId()).isEqualTo("ev-missing");
    }

    @Test
    void testObservationTargetedEvaluation() throws Exception {
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(
                ruleEvaluator("{\"rule_type\":\"not_contains\",\"target\":\"observation_output\","
                        + "\"substring\":\"error\"}")));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.of(
                Trace.builder().id("t1").projectId("p1").build()));
        when(observationRepository.findByIdAndProjectId("o1", "p1")).thenReturn(Optional.of(
                Observation.builder().id("o1").traceId("t1").projectId("p1").output("an error happened").build()));
        when(scoreRepository.save(any(Score.class))).thenAnswer(inv -> inv.getArgument(0));

        Score score = service.evaluate("p1", "ev1", "t1", "o1", Duration.ofSeconds(30)).orElseThrow();

        assertThat(score.getValue()).isEqualTo(0.0);
        assertThat(score.getObservationId()).isEqualTo("o1");
    }

    @Test
    void testLlmEvaluatorDispatchesToJudge() throws Exception {
        Evaluator evaluator = Evaluator.builder().id("ev2").projectId("p1").type(EvaluatorType.LLM)
                .promptTemplate("{{trace_output}}").scoreName("quality").scoreDataType(ScoreDataType.NUMERIC).build();
        Trace trace = Trace.builder().id("t1").projectId("p1").build();
        Score judged = Score.builder().projectId("p1").traceId("t1").name("quality").value(0.4).build();
        when(evaluatorRepository.findByIdAndProjectId("ev2", "p1")).thenReturn(Optional.of(evaluator));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.of(trace));
        when(llmJudge.judge(eq(evaluator), eq(trace), isNull(), any())).thenReturn(judged);
        when(scoreRepository.save(judged)).thenReturn(judged);

        assertThat(service.evaluate("p1", "ev2", "t1", null, Duration.ofSeconds(30))).contains(judged);
    }

    @Test
    void testMissingEvaluatorIsConfigError() {
        when(evaluatorRepository.findByIdAndProjectId("missing", "p1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.evaluate("p1", "missing", "t1", null, Duration.ofSeconds(30)))
                .isInstanceOf(EvaluatorConfigException.class)
                .hasMessage("evaluator not found: missing");
    }

    @Test
    void testDisabledEvaluatorSkipped() throws Exception {
        Evaluator evaluator = ruleEvaluator("{}");
        evaluator.setEnabled(false);
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(evaluator));

        assertThat(service.evaluate("p1", "ev1", "t1", null, Duration.ofSeconds(30))).isEmpty();
        verifyNoInteractions(traceRepository, scoreRepository);
    }

    @Test
    void testMissingTraceIsRetryable() {
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(ruleEvaluator("{}")));
        when(traceRepository.findByIdAndProjectId("t1", "p1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.evaluate("p1", "ev1", "t1", null, Duration.ofSeconds(30)))
                .isInstanceOf(IllegalStateException.class);
        verify(scoreRepository, never()).save(any());
    }

    @Test
    void testBatchCountsFailuresWithoutStopping() throws Exception {
        when(evaluatorRepository.findByIdAndProjectId("ev1", "p1")).thenReturn(Optional.of(
                ruleEvaluator("{\"rule_type\":\"length_check\",\"target\":\"trace_output\",\"min_length\":3}")));
        when(traceRepository.findByIdAndProjectId(anyString(), eq("p1"))).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            return "t2".equals(id) ? Optional.empty()
                    : Optional.of(Trace.builder().id(id).projectId("p1").output("hello").build());
        });
        when(scoreRepository.save(any(Score.class))).thenAnswer(inv -> inv.getArgument(0));

        BatchEvaluationResult result = service.evaluateBatch("p1", "ev1", List.of("t1", "t2", "t3"),
                () -> Duration.ofSeconds(30));

        assertThat(result.getTotal()).isEqualTo(3);
        assertThat(result.getSucceeded()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(1);
        ArgumentCaptor<Score> saved = ArgumentCaptor.forClass(Score.class);
        verify(scoreRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(Score::getTraceId).containsExactly("t1", "t3");
    }
}
