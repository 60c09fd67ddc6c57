package com.example.tracepipeline.worker;

import com.example.tracepipeline.notification.DailyCostReportService;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.DailyCostReportPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class DailyCostReportHandler implements JobHandler {

    private final DailyCostReportService reportService;
    private final Clock clock;

    @Override
    public JobType type() {
        return JobType.DAILY_COST_REPORT;
    }

    @Override
    public void handle(JobContext context) {
        DailyCostReportPayload payload = context.payloadAs(DailyCostReportPayload.class);
        reportService.sendReports(payload.getProjectId(), PayloadFields.dateOrYesterday(payload.getDate(), clock));
    }
}
