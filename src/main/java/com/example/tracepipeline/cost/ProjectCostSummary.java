package com.example.tracepipeline.cost;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * 单个项目一天的成本汇总，models 按成本降序。
 */
@Value
@Builder
public class ProjectCostSummary {
    String projectId;
    BigDecimal totalCost;
    long observationCount;
    long traceCount;
    List<ModelCostTotal> models;

    public static ProjectCostSummary empty(String projectId) {
        return ProjectCostSummary.builder()
                .projectId(projectId)
                .totalCost(BigDecimal.ZERO)
                .models(List.of())
                .build();
    }
}
