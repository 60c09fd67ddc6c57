package com.example.tracepipeline.worker;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.BatchCostCalculationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BatchCostCalculationHandler implements JobHandler {

    private final CostAttributionService costAttributionService;

    @Override
    public JobType type() {
        return JobType.BATCH_COST_CALCULATION;
    }

    @Override
    public void handle(JobContext context) {
        BatchCostCalculationPayload payload = context.payloadAs(BatchCostCalculationPayload.class);
        costAttributionService.calculateBatch(
                PayloadFields.required(payload.getProjectId(), "project_id"),
                PayloadFields.required(payload.getTraceId(), "trace_id"));
    }
}
