package com.example.automation.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 一次逻辑投递（某个事件发往某个 webhook），跨越多次尝试。
 * <p>
 * nextRetryAt 既是待重试的到期时间，也是认领后的租约截止时间。
 * 每次认领都会递增 version，执行者只在持有的 version 仍是当前值时写回结果。
 */
@Entity
@Table(name = "webhook_deliveries",
        uniqueConstraints = @UniqueConstraint(name = "uk_delivery_source", columnNames = {"sourceEventId", "webhookId"}),
        indexes = {
                @Index(name = "idx_delivery_webhook", columnList = "webhookId,createdAt"),
                @Index(name = "idx_delivery_due", columnList = "status,nextRetryAt")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private Long webhookId;

    // 事件来源记录 ID（Redis Stream 记录），重复消费同一记录时不重复创建投递
    @Column(length = 64)
    private String sourceEventId;

    @Column(nullable = false, length = 64)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Builder.Default
    private int attemptCount = 0;

    @Column(nullable = false)
    private Instant sequenceStartedAt;

    @Builder.Default
    private int sequenceStartAttempt = 1;

    private Instant nextRetryAt;

    private Instant lastAttemptAt;

    private Integer lastStatusCode;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant completedAt;

    @Version
    private Long version;

    /**
     * 当前自动重试序列中的第几次尝试（从 1 开始）。
     */
    public int attemptsInSequence() {
        return attemptCount - sequenceStartAttempt + 1;
    }
}
