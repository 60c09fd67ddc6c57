package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评估器配置。由项目管理端维护，这里只读，每次任务执行时重新加载。
 */
@Entity
@Table(name = "evaluator")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Evaluator {

    @Id
    private String id;

    @Column(nullable = false)
    private String projectId;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EvaluatorType type;

    @Column(columnDefinition = "TEXT")
    private String promptTemplate;

    @Column(columnDefinition = "TEXT")
    private String config; // 规则配置 JSON，或 LLM 的 {"model": "..."}

    @Column(nullable = false)
    private String scoreName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScoreDataType scoreDataType;

    @Builder.Default
    private boolean enabled = true;
}
