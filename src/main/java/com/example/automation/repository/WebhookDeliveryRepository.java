package com.example.automation.repository;

import com.example.automation.model.DeliveryStatus;
import com.example.automation.model.WebhookDelivery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 投递仓储接口。
 */
@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, String> {

        Page<WebhookDelivery> findByWebhookIdOrderByCreatedAtDesc(Long webhookId, Pageable pageable);

        long countByStatus(DeliveryStatus status);

        /**
         * 查询到期待重试的投递（包括租约过期的认领）。
         */
        @Query("SELECT d FROM WebhookDelivery d WHERE d.status = com.example.automation.model.DeliveryStatus.PENDING "
                        + "AND d.nextRetryAt <= :now ORDER BY d.nextRetryAt ASC")
        List<WebhookDelivery> findDue(@Param("now") Instant now, Pageable pageable);

        boolean existsBySourceEventIdAndWebhookId(String sourceEventId, Long webhookId);

        /**
         * 认领投递：version 仍为预期值时递增 version 并把 nextRetryAt 推到租约截止时间。
         * 轮询认领到期重试与执行者发送前的认领都走这里。
         *
         * @return 1 表示认领成功
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE WebhookDelivery d SET d.nextRetryAt = :leaseUntil, d.version = d.version + 1 "
                        + "WHERE d.id = :id "
                        + "AND d.status = com.example.automation.model.DeliveryStatus.PENDING "
                        + "AND d.version = :expectedVersion")
        int claim(@Param("id") String id,
                        @Param("expectedVersion") long expectedVersion,
                        @Param("leaseUntil") Instant leaseUntil);

        /**
         * 手动重试：仅对终态失败的投递开启新一轮尝试序列，同时认领它。
         *
         * @return 1 表示已重新排队并认领
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE WebhookDelivery d SET d.status = com.example.automation.model.DeliveryStatus.PENDING, "
                        + "d.sequenceStartedAt = :now, d.sequenceStartAttempt = d.attemptCount + 1, "
                        + "d.nextRetryAt = :leaseUntil, d.completedAt = NULL, d.version = d.version + 1 "
                        + "WHERE d.id = :id AND d.status = com.example.automation.model.DeliveryStatus.FAILED "
                        + "AND d.version = :expectedVersion")
        int requeueFailed(@Param("id") String id,
                        @Param("expectedVersion") long expectedVersion,
                        @Param("now") Instant now,
                        @Param("leaseUntil") Instant leaseUntil);

        void deleteByWebhookId(Long webhookId);
}
