package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 一次 span / generation 观测。成本字段只由成本计算任务写入。
 */
@Entity
@Table(name = "observation", indexes = {
        @Index(name = "idx_observation_trace", columnList = "projectId,traceId"),
        @Index(name = "idx_observation_start", columnList = "startTime")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Observation {

    @Id
    private String id;

    @Column(nullable = false)
    private String traceId;

    @Column(nullable = false)
    private String projectId;

    private String name;

    private String type; // SPAN, GENERATION, EVENT

    private String model;

    @Column(columnDefinition = "TEXT")
    private String input;

    @Column(columnDefinition = "TEXT")
    private String output;

    private Instant startTime;

    private Long inputTokens;

    private Long outputTokens;

    @Column(precision = 20, scale = 10)
    private BigDecimal inputCost;

    @Column(precision = 20, scale = 10)
    private BigDecimal outputCost;

    @Column(precision = 20, scale = 10)
    private BigDecimal totalCost;

    /**
     * 是否已计算过成本
     */
    public boolean isPriced() {
        return totalCost != null && totalCost.signum() > 0;
    }
}
