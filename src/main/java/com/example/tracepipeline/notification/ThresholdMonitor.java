package com.example.tracepipeline.notification;

import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Trace;
import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.queue.JobClient;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.repository.TraceRepository;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.worker.payload.NotificationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 已完成 trace 的成本/延迟阈值检查，每个越线的 Webhook 入队一条通知任务。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdMonitor {

    private final TraceRepository traceRepository;
    private final WebhookRepository webhookRepository;
    private final JobClient jobClient;
    private final Clock clock;

    /**
     * 检查 trace 是否超过项目 Webhook 配置的阈值。成本与延迟分别查询、分别通知。
     *
     * @param traceId   trace ID
     * @param projectId 项目 ID
     * @return 入队的通知任务数；trace 不存在时为 0
     */
    public int check(String traceId, String projectId) {
        Optional<Trace> found = traceRepository.findByIdAndProjectId(traceId, projectId);
        if (found.isEmpty()) {
            log.debug("Trace {} not found in project {}, skipping threshold check", traceId, projectId);
            return 0;
        }
        Trace trace = found.get();
        return checkCost(trace) + checkLatency(trace);
    }

    private int checkCost(Trace trace) {
        if (trace.getTotalCost() == null) {
            return 0;
        }
        int enqueued = 0;
        for (Webhook webhook : listWebhooks(trace.getProjectId(), EventType.TRACE_COST_THRESHOLD)) {
            if (webhook.getCostThreshold() == null || trace.getTotalCost().compareTo(webhook.getCostThreshold()) <= 0) {
                continue;
            }
            Map<String, Object> data = baseData(trace);
            data.put("cost", trace.getTotalCost());
            data.put("threshold", webhook.getCostThreshold());
            enqueued += enqueue(webhook, EventType.TRACE_COST_THRESHOLD, data);
        }
        return enqueued;
    }

    private int checkLatency(Trace trace) {
        if (trace.getDurationMs() == null) {
            return 0;
        }
        int enqueued = 0;
        for (Webhook webhook : listWebhooks(trace.getProjectId(), EventType.TRACE_LATENCY_THRESHOLD)) {
            if (webhook.getLatencyThreshold() == null || trace.getDurationMs() <= webhook.getLatencyThreshold()) {
                continue;
            }
            Map<String, Object> data = baseData(trace);
            data.put("latencyMs", trace.getDurationMs());
            data.put("threshold", webhook.getLatencyThreshold());
            enqueued += enqueue(webhook, EventType.TRACE_LATENCY_THRESHOLD, data);
        }
        return enqueued;
    }

    private List<Webhook> listWebhooks(String projectId, EventType eventType) {
        try {
            return webhookRepository.findEnabledByProjectAndEvent(projectId, eventType);
        } catch (RuntimeException e) {
            log.error("Failed to list {} webhooks for project {}", eventType.getValue(), projectId, e);
            return List.of();
        }
    }

    private Map<String, Object> baseData(Trace trace) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("traceId", trace.getId());
        data.put("traceName", trace.getName());
        data.put("projectId", trace.getProjectId());
        Instant timestamp = trace.getStartTime() != null ? trace.getStartTime() : clock.instant();
        data.put("timestamp", timestamp.toString());
        return data;
    }

    private int enqueue(Webhook webhook, EventType eventType, Map<String, Object> data) {
        try {
            jobClient.enqueue(JobType.NOTIFICATION_SEND, new NotificationPayload(webhook.getId(), eventType, data));
        } catch (RuntimeException e) {
            // 单个入队失败不影响其余越线通知
            log.error("Failed to enqueue {} notification for webhook {} (trace {})", eventType.getValue(),
                    webhook.getId(), data.get("traceId"), e);
            return 0;
        }
        log.info("Threshold crossed: trace={}, event={}, webhook={}", data.get("traceId"), eventType.getValue(),
                webhook.getId());
        return 1;
    }
}
