package com.example.tracepipeline.worker;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.CostCalculationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CostCalculationHandler implements JobHandler {

    private final CostAttributionService costAttributionService;

    @Override
    public JobType type() {
        return JobType.COST_CALCULATION;
    }

    @Override
    public void handle(JobContext context) {
        CostCalculationPayload payload = context.payloadAs(CostCalculationPayload.class);
        costAttributionService.calculate(
                PayloadFields.required(payload.getProjectId(), "project_id"),
                payload.getTraceId(),
                PayloadFields.required(payload.getObservationId(), "observation_id"),
                PayloadFields.required(payload.getModel(), "model"),
                payload.getPromptTokens(),
                payload.getCompletionTokens());
    }
}
