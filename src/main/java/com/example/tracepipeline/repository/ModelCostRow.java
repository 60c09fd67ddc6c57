package com.example.tracepipeline.repository;

import java.math.BigDecimal;

/**
 * 按项目、模型聚合的一行成本统计。
 */
public interface ModelCostRow {

    String getProjectId();

    String getModel();

    long getObservationCount();

    long getTraceCount();

    Long getInputTokens();

    Long getOutputTokens();

    BigDecimal getTotalCost();
}
