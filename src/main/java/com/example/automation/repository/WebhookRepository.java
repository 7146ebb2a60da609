package com.example.automation.repository;

import com.example.automation.model.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Webhook 仓储接口。
 * <p>
 * 失败计数与自动停用只通过原子 UPDATE 修改，避免并发投递之间丢失更新。
 */
@Repository
public interface WebhookRepository extends JpaRepository<Webhook, Long> {

        Optional<Webhook> findByIdAndUserId(Long id, String userId);

        List<Webhook> findByUserIdOrderByCreatedAtDesc(String userId);

        long countByEnabledTrue();

        /**
         * 查询订阅了指定事件的启用 webhook（项目级与全局）。
         *
         * @param userId    用户 ID
         * @param projectId 项目 ID，可为空
         * @param eventType 事件类型
         * @return 匹配的 webhook
         */
        @Query("SELECT DISTINCT w FROM Webhook w WHERE w.enabled = true AND w.userId = :userId "
                        + "AND (w.projectId IS NULL OR w.projectId = :projectId) "
                        + "AND :eventType MEMBER OF w.events")
        List<Webhook> findMatching(@Param("userId") String userId,
                        @Param("projectId") String projectId,
                        @Param("eventType") String eventType);

        /**
         * 投递成功：清零失败计数。
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Webhook w SET w.consecutiveFailures = 0, w.lastTriggeredAt = :at, w.lastStatusCode = :statusCode "
                        + "WHERE w.id = :id")
        int recordSuccess(@Param("id") Long id, @Param("at") Instant at, @Param("statusCode") Integer statusCode);

        /**
         * 投递失败：失败计数加一。
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Webhook w SET w.consecutiveFailures = w.consecutiveFailures + 1, w.lastTriggeredAt = :at, "
                        + "w.lastStatusCode = :statusCode WHERE w.id = :id")
        int recordFailure(@Param("id") Long id, @Param("at") Instant at, @Param("statusCode") Integer statusCode);

        /**
         * 失败计数达到阈值时停用。
         *
         * @return 1 表示本次调用完成了停用
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Webhook w SET w.enabled = false WHERE w.id = :id AND w.enabled = true "
                        + "AND w.consecutiveFailures >= :threshold")
        int disableIfFailuresReached(@Param("id") Long id, @Param("threshold") int threshold);
}
