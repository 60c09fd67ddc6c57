package com.example.tracepipeline.notification;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.cost.DailyCostSummary;
import com.example.tracepipeline.cost.ModelCostTotal;
import com.example.tracepipeline.cost.ProjectCostSummary;
import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.queue.JobClient;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.worker.payload.NotificationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 每日成本报告：按项目汇总前一天的成本，向订阅了 daily.cost_report 的 Webhook 发通知。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DailyCostReportService {

    static final int TOP_MODELS = 5;

    private final CostAttributionService costAttributionService;
    private final WebhookRepository webhookRepository;
    private final JobClient jobClient;

    /**
     * 生成并入队报告通知。
     *
     * @param projectId 项目 ID，null 表示所有有订阅者的项目
     * @param date      统计日期（UTC）
     * @return 入队的通知任务数
     */
    public int sendReports(String projectId, LocalDate date) {
        List<String> projectIds = projectId != null
                ? List.of(projectId)
                : webhookRepository.findProjectIdsWithEnabledEvent(EventType.DAILY_COST_REPORT);
        if (projectIds.isEmpty()) {
            log.debug("No projects subscribed to daily cost reports");
            return 0;
        }

        DailyCostSummary summary = costAttributionService.aggregateDaily(projectId, date);
        int enqueued = 0;
        for (String id : projectIds) {
            List<Webhook> webhooks = webhookRepository.findEnabledByProjectAndEvent(id, EventType.DAILY_COST_REPORT);
            if (webhooks.isEmpty()) {
                continue;
            }
            Map<String, Object> data = reportData(summary.forProject(id), date);
            for (Webhook webhook : webhooks) {
                try {
                    jobClient.enqueue(JobType.NOTIFICATION_SEND,
                            new NotificationPayload(webhook.getId(), EventType.DAILY_COST_REPORT, data));
                    enqueued++;
                } catch (RuntimeException e) {
                    // 单个入队失败不影响其余 Webhook
                    log.error("Failed to enqueue daily cost report for webhook {} (project {})",
                            webhook.getId(), id, e);
                }
            }
        }
        log.info("Daily cost report for {}: {} notification(s) enqueued", date, enqueued);
        return enqueued;
    }

    static Map<String, Object> reportData(ProjectCostSummary project, LocalDate date) {
        List<Map<String, Object>> topModels = project.getModels().stream()
                .limit(TOP_MODELS)
                .map(DailyCostReportService::modelEntry)
                .collect(Collectors.toList());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectId", project.getProjectId());
        data.put("date", date.toString());
        data.put("totalCost", project.getTotalCost());
        data.put("traceCount", project.getTraceCount());
        data.put("observationCount", project.getObservationCount());
        data.put("topModels", topModels);
        return data;
    }

    private static Map<String, Object> modelEntry(ModelCostTotal model) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("model", model.getModel());
        entry.put("cost", model.getCost());
        entry.put("count", model.getObservationCount());
        return entry;
    }
}
