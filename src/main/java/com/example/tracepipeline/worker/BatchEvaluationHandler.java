package com.example.tracepipeline.worker;

import com.example.tracepipeline.evaluation.EvaluationService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.BatchEvaluationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 批量评估。单条失败只计数，整批不重试。
 */
@Component
@RequiredArgsConstructor
public class BatchEvaluationHandler implements JobHandler {

    private final EvaluationService evaluationService;

    @Override
    public JobType type() {
        return JobType.BATCH_EVALUATION;
    }

    @Override
    public void handle(JobContext context) throws InterruptedException {
        BatchEvaluationPayload payload = context.payloadAs(BatchEvaluationPayload.class);
        List<String> traceIds = payload.getTraceIds() != null ? payload.getTraceIds() : List.of();
        evaluationService.evaluateBatch(
                PayloadFields.required(payload.getProjectId(), "project_id"),
                PayloadFields.required(payload.getEvaluatorId(), "evaluator_id"),
                traceIds,
                context::remaining);
    }
}
