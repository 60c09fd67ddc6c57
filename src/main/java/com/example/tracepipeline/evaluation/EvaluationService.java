package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.repository.EvaluatorRepository;
import com.example.tracepipeline.repository.ObservationRepository;
import com.example.tracepipeline.repository.ScoreRepository;
import com.example.tracepipeline.repository.TraceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 评估流程：加载评估器 → 加载 trace / 观测 → 按类型分派 → 保存分数。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationService {

    private final EvaluatorRepository evaluatorRepository;
    private final TraceRepository traceRepository;
    private final ObservationRepository observationRepository;
    private final ScoreRepository scoreRepository;
    private final RuleEvaluator ruleEvaluator;
    private final LlmJudge llmJudge;

    /**
     * 运行单次评估。
     *
     * @param projectId     项目 ID
     * @param evaluatorId   评估器 ID
     * @param traceId       trace ID
     * @param observationId 观测 ID，可为 null
     * @param budget        剩余时间预算
     * @return 已保存的分数；评估器已停用时为 empty
     * @throws EvaluatorConfigException 评估器不存在或配置错误，不可重试
     * @throws IllegalStateException    trace 或观测尚未写入，可重试
     * @throws Exception                LLM 调用等其他失败
     */
    public Optional<Score> evaluate(String projectId, String evaluatorId, String traceId, String observationId,
                                    Duration budget) throws Exception {
        log.info("Processing evaluation: evaluatorId={}, traceId={}, observationId={}",
                evaluatorId, traceId, observationId);

        Evaluator evaluator = evaluatorRepository.findByIdAndProjectId(evaluatorId, projectId)
                .orElseThrow(() -> new EvaluatorConfigException("evaluator not found: " + evaluatorId));

        if (!evaluator.isEnabled()) {
            log.info("Evaluator {} is not active, skipping", evaluatorId);
            return Optional.empty();
        }

        // 数据写入可能滞后于任务，找不到时交给队列重试
        Trace trace = traceRepository.findByIdAndProjectId(traceId, projectId)
                .orElseThrow(() -> new IllegalStateException("trace not found: " + traceId));

        Observation observation = null;
        if (observationId != null && !observationId.isEmpty()) {
            observation = observationRepository.findByIdAndProjectId(observationId, projectId)
                    .orElseThrow(() -> new IllegalStateException("observation not found: " + observationId));
        }

        Score score;
        switch (evaluator.getType()) {
            case LLM:
                score = llmJudge.judge(evaluator, trace, observation, budget);
                break;
            case RULE:
                score = ruleEvaluator.evaluate(evaluator, trace, observation);
                break;
            default:
                throw new EvaluatorConfigException("unsupported evaluator type: " + evaluator.getType());
        }

        Score saved = scoreRepository.save(score);
        log.info("Evaluation completed: evaluatorId={}, traceId={}, scoreId={}, value={}, stringValue={}",
                evaluatorId, traceId, saved.getId(), saved.getValue(), saved.getStringValue());
        return Optional.of(saved);
    }

    /**
     * 依次评估多条 trace。单条失败只计数，不中断整批。
     *
     * @param budget 每条评估开始前的剩余时间预算
     * @return 统计结果
     * @throws InterruptedException 批任务被取消
     */
    public BatchEvaluationResult evaluateBatch(String projectId, String evaluatorId, List<String> traceIds,
                                               Supplier<Duration> budget) throws InterruptedException {
        log.info("Processing batch evaluation: evaluatorId={}, traceCount={}", evaluatorId, traceIds.size());

        int succeeded = 0;
        int failed = 0;
        for (String traceId : traceIds) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Batch evaluation cancelled");
            }
            try {
                evaluate(projectId, evaluatorId, traceId, null, budget.get());
                succeeded++;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                failed++;
                log.warn("Evaluation failed in batch: evaluatorId={}, traceId={}, error={}",
                        evaluatorId, traceId, e.getMessage());
            }
        }

        if (failed > 0) {
            log.warn("Batch evaluation completed with errors: total={}, errors={}", traceIds.size(), failed);
        } else {
            log.info("Batch evaluation completed successfully: total={}", traceIds.size());
        }
        return new BatchEvaluationResult(traceIds.size(), succeeded, failed);
    }
}
