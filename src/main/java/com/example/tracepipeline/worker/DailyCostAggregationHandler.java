package com.example.tracepipeline.worker;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.DailyAggregationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 每日成本汇总，只读，结果写入日志。
 */
@Component
@RequiredArgsConstructor
public class DailyCostAggregationHandler implements JobHandler {

    private final CostAttributionService costAttributionService;
    private final Clock clock;

    @Override
    public JobType type() {
        return JobType.DAILY_COST_AGGREGATION;
    }

    @Override
    public void handle(JobContext context) {
        DailyAggregationPayload payload = context.payloadAs(DailyAggregationPayload.class);
        costAttributionService.aggregateDaily(payload.getProjectId(),
                PayloadFields.dateOrYesterday(payload.getDate(), clock));
    }
}
