package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 租户配置的通知 Webhook。这里只更新 lastTriggeredAt。
 */
@Entity
@Table(name = "webhook")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Webhook {

    @Id
    private String id;

    @Column(nullable = false)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private WebhookType type = WebhookType.GENERIC;

    private String name;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(columnDefinition = "TEXT")
    private String secret; // 非空时对请求体做 HMAC-SHA256 签名

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_event", joinColumns = @JoinColumn(name = "webhook_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type")
    @Builder.Default
    private Set<EventType> events = EnumSet.noneOf(EventType.class);

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_header", joinColumns = @JoinColumn(name = "webhook_id"))
    @MapKeyColumn(name = "header_name")
    @Column(name = "header_value")
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    @Builder.Default
    private boolean enabled = true;

    @Column(precision = 20, scale = 10)
    private BigDecimal costThreshold; // 单条 trace 成本（USD）

    private Long latencyThreshold; // 毫秒

    private Integer rateLimitPerHour; // null 表示不限

    private Instant lastTriggeredAt;

    public boolean isSubscribedTo(EventType eventType) {
        return events != null && events.contains(eventType);
    }
}
