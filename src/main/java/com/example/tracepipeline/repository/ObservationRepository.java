package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.Observation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 观测数据仓储接口。
 */
@Repository
public interface ObservationRepository extends JpaRepository<Observation, String> {

    Optional<Observation> findByIdAndProjectId(String id, String projectId);

    List<Observation> findByProjectIdAndTraceId(String projectId, String traceId);

    /**
     * 写回成本字段
     *
     * @return 更新记录数
     */
    @Modifying
    @Transactional
    @Query("UPDATE Observation o SET o.inputCost = :inputCost, o.outputCost = :outputCost, "
            + "o.totalCost = :totalCost WHERE o.id = :id AND o.projectId = :projectId")
    int updateCosts(@Param("projectId") String projectId,
                    @Param("id") String id,
                    @Param("inputCost") BigDecimal inputCost,
                    @Param("outputCost") BigDecimal outputCost,
                    @Param("totalCost") BigDecimal totalCost);

    /**
     * 统计时间窗口内已计价观测的成本，按项目和模型分组。
     *
     * @param projectId 项目 ID，null 表示全部项目
     * @param from      窗口起点（含）
     * @param to        窗口终点（不含）
     * @return 聚合结果
     */
    @Query("SELECT o.projectId AS projectId, o.model AS model, COUNT(o) AS observationCount, "
            + "COUNT(DISTINCT o.traceId) AS traceCount, SUM(o.inputTokens) AS inputTokens, "
            + "SUM(o.outputTokens) AS outputTokens, SUM(o.totalCost) AS totalCost "
            + "FROM Observation o "
            + "WHERE o.startTime >= :from AND o.startTime < :to AND o.totalCost IS NOT NULL "
            + "AND o.model IS NOT NULL AND (:projectId IS NULL OR o.projectId = :projectId) "
            + "GROUP BY o.projectId, o.model")
    List<ModelCostRow> aggregateCosts(@Param("projectId") String projectId,
                                      @Param("from") Instant from,
                                      @Param("to") Instant to);

    /**
     * 时间窗口内有已计价观测的 trace 数量，按项目分组。
     */
    @Query("SELECT o.projectId AS projectId, COUNT(DISTINCT o.traceId) AS traceCount "
            + "FROM Observation o "
            + "WHERE o.startTime >= :from AND o.startTime < :to AND o.totalCost IS NOT NULL "
            + "AND (:projectId IS NULL OR o.projectId = :projectId) "
            + "GROUP BY o.projectId")
    List<ProjectTraceCount> countTraces(@Param("projectId") String projectId,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);
}
