package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * 投递审计记录，每次进入 HTTP 阶段的投递尝试写一行。
 */
@Entity
@Table(name = "webhook_delivery", indexes = @Index(name = "idx_delivery_webhook", columnList = "webhookId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String webhookId;

    @Enumerated(EnumType.STRING)
    private EventType eventType;

    @Column(columnDefinition = "TEXT")
    private String payload;

    private Integer statusCode;

    @Column(columnDefinition = "TEXT")
    private String response;

    private boolean success;

    @Column(columnDefinition = "TEXT")
    private String error;

    private long durationMs;

    private int retryCount; // 投递时任务的重试次数

    @CreationTimestamp
    private Instant createdAt;
}
