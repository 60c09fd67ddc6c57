package com.example.tracepipeline.notification;

import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.WebhookType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 按 Webhook 类型构建请求体：通用信封、Slack 附件、Discord embed、Teams 消息卡片、PagerDuty 事件。
 */
@Component
public class WebhookPayloadBuilder {

    private static final String FOOTER = "Trace Pipeline";

    private final String dashboardUrl;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public WebhookPayloadBuilder(@Value("${app.notification.dashboard-url:http://localhost:3000}") String dashboardUrl,
                                 Clock clock,
                                 ObjectMapper objectMapper) {
        this.dashboardUrl = dashboardUrl.endsWith("/") ? dashboardUrl.substring(0, dashboardUrl.length() - 1)
                : dashboardUrl;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * 构建请求体 JSON。
     *
     * @param type      Webhook 类型
     * @param eventType 事件类型
     * @param data      事件数据
     * @return JSON 字符串
     * @throws JsonProcessingException 数据无法序列化
     */
    public String build(WebhookType type, EventType eventType, Map<String, Object> data)
            throws JsonProcessingException {
        Map<String, Object> safeData = data != null ? data : Map.of();
        Object body;
        switch (type != null ? type : WebhookType.GENERIC) {
            case SLACK:
                body = slack(eventType, safeData);
                break;
            case DISCORD:
                body = discord(eventType, safeData);
                break;
            case MSTEAMS:
                body = msTeams(eventType, safeData);
                break;
            case PAGERDUTY:
                body = pagerDuty(eventType, safeData);
                break;
            default:
                body = generic(eventType, safeData);
                break;
        }
        return objectMapper.writeValueAsString(body);
    }

    private Map<String, Object> generic(EventType eventType, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", UUID.randomUUID().toString());
        payload.put("eventType", eventType.getValue());
        String projectId = stringOrNull(data, "projectId");
        if (projectId != null) {
            payload.put("projectId", projectId);
        }
        payload.put("timestamp", clock.instant().toString());
        payload.put("data", data);
        return payload;
    }

    private Map<String, Object> slack(EventType eventType, Map<String, Object> data) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", "#" + colorHex(eventType));
        attachment.put("title", title(eventType));
        attachment.put("text", message(eventType, data));
        attachment.put("footer", FOOTER);
        attachment.put("ts", clock.instant().getEpochSecond());

        List<Map<String, Object>> fields = new ArrayList<>();
        String traceId = stringOrNull(data, "traceId");
        if (traceId != null) {
            attachment.put("title_link", traceLink(traceId));
            fields.add(Map.of("title", "Trace ID", "value", traceId, "short", true));
        }
        String projectName = stringOrNull(data, "projectName");
        if (projectName != null) {
            fields.add(Map.of("title", "Project", "value", projectName, "short", true));
        }
        if (!fields.isEmpty()) {
            attachment.put("fields", fields);
        }
        return Map.of("attachments", List.of(attachment));
    }

    private Map<String, Object> discord(EventType eventType, Map<String, Object> data) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", title(eventType));
        embed.put("description", message(eventType, data));
        embed.put("color", Integer.parseInt(colorHex(eventType), 16));
        embed.put("timestamp", clock.instant().toString());
        embed.put("footer", Map.of("text", FOOTER));

        List<Map<String, Object>> fields = new ArrayList<>();
        String traceId = stringOrNull(data, "traceId");
        if (traceId != null) {
            embed.put("url", traceLink(traceId));
            fields.add(Map.of("name", "Trace ID", "value", traceId, "inline", true));
        }
        String projectName = stringOrNull(data, "projectName");
        if (projectName != null) {
            fields.add(Map.of("name", "Project", "value", projectName, "inline", true));
        }
        if (!fields.isEmpty()) {
            embed.put("fields", fields);
        }

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("username", FOOTER);
        message.put("embeds", List.of(embed));
        return message;
    }

    private Map<String, Object> msTeams(EventType eventType, Map<String, Object> data) {
        String title = title(eventType);
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("@type", "MessageCard");
        card.put("@context", "http://schema.org/extensions");
        card.put("themeColor", colorHex(eventType));
        card.put("summary", title);
        card.put("sections", List.of(Map.of("activityTitle", title, "text", message(eventType, data))));
        String traceId = stringOrNull(data, "traceId");
        if (traceId != null) {
            card.put("potentialAction", List.of(Map.of(
                    "@type", "OpenUri",
                    "name", "View Trace",
                    "targets", List.of(Map.of("os", "default", "uri", traceLink(traceId))))));
        }
        return card;
    }

    private Map<String, Object> pagerDuty(EventType eventType, Map<String, Object> data) {
        String severity;
        switch (eventType) {
            case TRACE_ERROR:
            case EVAL_FAILED:
                severity = "error";
                break;
            case ANOMALY_DETECTED:
                severity = "critical";
                break;
            default:
                severity = "warning";
                break;
        }
        String traceName = stringOrNull(data, "traceName");
        String summary = traceName != null ? eventType.getValue() + ": " + traceName : eventType.getValue();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("summary", summary);
        details.put("severity", severity);
        details.put("source", "trace-pipeline");
        details.put("custom_details", data);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", "");
        event.put("event_action", "trigger");
        event.put("payload", details);
        String traceId = stringOrNull(data, "traceId");
        if (traceId != null) {
            event.put("dedup_key", traceId);
            event.put("links", List.of(Map.of("href", traceLink(traceId), "text", "View trace")));
        }
        return event;
    }

    private String traceLink(String traceId) {
        return dashboardUrl + "/traces/" + traceId;
    }

    static String title(EventType eventType) {
        switch (eventType) {
            case TRACE_ERROR:
                return "Trace Error Alert";
            case TRACE_COST_THRESHOLD:
                return "Cost Threshold Exceeded";
            case TRACE_LATENCY_THRESHOLD:
                return "Latency Threshold Exceeded";
            case DAILY_COST_REPORT:
                return "Daily Cost Report";
            case EVAL_FAILED:
                return "Evaluation Failed";
            case EVAL_SCORE_LOW:
                return "Low Evaluation Score";
            case ANOMALY_DETECTED:
                return "Anomaly Detected";
            default:
                return eventType.getValue();
        }
    }

    private static String colorHex(EventType eventType) {
        switch (eventType) {
            case TRACE_ERROR:
            case EVAL_FAILED:
                return "dc3545";
            case TRACE_COST_THRESHOLD:
            case TRACE_LATENCY_THRESHOLD:
            case EVAL_SCORE_LOW:
                return "ffc107";
            case DAILY_COST_REPORT:
                return "17a2b8";
            default:
                return "6f42c1";
        }
    }

    String message(EventType eventType, Map<String, Object> data) {
        switch (eventType) {
            case TRACE_ERROR:
                return String.format(Locale.ROOT, "Trace '%s' failed with error:\n```%s```",
                        text(data, "traceName", "Unknown"), text(data, "error", "An error occurred"));
            case TRACE_COST_THRESHOLD:
                return String.format(Locale.ROOT, "Trace '%s' cost $%.4f exceeded threshold of $%.4f",
                        text(data, "traceName", "Unknown"), number(data, "cost"), number(data, "threshold"));
            case TRACE_LATENCY_THRESHOLD:
                return String.format(Locale.ROOT, "Trace '%s' latency %.0fms exceeded threshold of %.0fms",
                        text(data, "traceName", "Unknown"), number(data, "latencyMs"), number(data, "threshold"));
            case DAILY_COST_REPORT:
                return String.format(Locale.ROOT, "Daily summary for %s:\n- Total Cost: $%.2f\n- Total Traces: %d",
                        text(data, "date", LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).toString()),
                        number(data, "totalCost"), (long) number(data, "traceCount"));
            case EVAL_FAILED:
                return String.format(Locale.ROOT, "Evaluator '%s' failed on trace '%s':\n```%s```",
                        text(data, "evaluatorName", "Unknown"), text(data, "traceName", "Unknown"),
                        text(data, "error", "Evaluation failed"));
            case EVAL_SCORE_LOW:
                return String.format(Locale.ROOT, "Score '%s' = %.2f (below threshold %.2f) on trace '%s'",
                        text(data, "scoreName", "Unknown"), number(data, "score"), number(data, "threshold"),
                        text(data, "traceName", "Unknown"));
            default:
                return String.format(Locale.ROOT, "Anomaly detected: %s\n%s",
                        text(data, "anomalyType", "Unknown"), text(data, "description", "Anomaly detected"));
        }
    }

    private static String stringOrNull(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof String ? (String) value : null;
    }

    private static String text(Map<String, Object> data, String key, String defaultValue) {
        String value = stringOrNull(data, key);
        return value != null ? value : defaultValue;
    }

    // 数据经过 JSON 往返后数字可能是 Integer、Double 或字符串
    private static double number(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
