package com.example.tracepipeline.worker;

import com.example.tracepipeline.notification.ThresholdMonitor;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.worker.payload.ThresholdCheckPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ThresholdCheckHandler implements JobHandler {

    private final ThresholdMonitor thresholdMonitor;

    @Override
    public JobType type() {
        return JobType.THRESHOLD_CHECK;
    }

    @Override
    public void handle(JobContext context) {
        ThresholdCheckPayload payload = context.payloadAs(ThresholdCheckPayload.class);
        thresholdMonitor.check(
                PayloadFields.required(payload.getTraceId(), "traceId"),
                PayloadFields.required(payload.getProjectId(), "projectId"));
    }
}
