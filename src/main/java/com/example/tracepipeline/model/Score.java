package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * 评估结果，只追加不修改。NUMERIC/BOOLEAN 填 value，CATEGORICAL 填 stringValue。
 */
@Entity
@Table(name = "score", indexes = @Index(name = "idx_score_trace", columnList = "projectId,traceId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Score {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String projectId;

    @Column(nullable = false)
    private String traceId;

    private String observationId;

    @Column(nullable = false)
    private String name;

    private Double value;

    private String stringValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScoreDataType dataType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScoreSource source;

    @Column(columnDefinition = "TEXT")
    private String comment;

    private String configId; // 产生该分数的评估器

    @CreationTimestamp
    private Instant createdAt;
}
