package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Webhook 仓储接口。
 */
@Repository
public interface WebhookRepository extends JpaRepository<Webhook, String> {

    /**
     * 查询项目下订阅了指定事件的启用 Webhook。
     *
     * @param projectId 项目 ID
     * @param eventType 事件类型
     * @return Webhook 列表
     */
    @Query("SELECT DISTINCT w FROM Webhook w JOIN w.events e "
            + "WHERE w.projectId = :projectId AND w.enabled = true AND e = :eventType")
    List<Webhook> findEnabledByProjectAndEvent(@Param("projectId") String projectId,
                                               @Param("eventType") EventType eventType);

    /**
     * 有启用 Webhook 订阅了指定事件的项目。
     */
    @Query("SELECT DISTINCT w.projectId FROM Webhook w JOIN w.events e "
            + "WHERE w.enabled = true AND e = :eventType")
    List<String> findProjectIdsWithEnabledEvent(@Param("eventType") EventType eventType);

    @Modifying
    @Transactional
    @Query("UPDATE Webhook w SET w.lastTriggeredAt = :triggeredAt WHERE w.id = :id")
    int updateLastTriggered(@Param("id") String id, @Param("triggeredAt") Instant triggeredAt);
}
