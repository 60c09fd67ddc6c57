package com.example.tracepipeline.worker;

import com.example.tracepipeline.evaluation.EvaluationService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.EvaluationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EvaluationHandler implements JobHandler {

    private final EvaluationService evaluationService;

    @Override
    public JobType type() {
        return JobType.EVALUATION;
    }

    @Override
    public void handle(JobContext context) throws Exception {
        EvaluationPayload payload = context.payloadAs(EvaluationPayload.class);
        evaluationService.evaluate(
                PayloadFields.required(payload.getProjectId(), "project_id"),
                PayloadFields.required(payload.getEvaluatorId(), "evaluator_id"),
                PayloadFields.required(payload.getTraceId(), "trace_id"),
                payload.getObservationId(),
                context.remaining());
    }
}
