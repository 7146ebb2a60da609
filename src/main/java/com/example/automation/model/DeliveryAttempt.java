package com.example.automation.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单次 HTTP 投递尝试记录，只追加不修改。
 */
@Entity
@Table(name = "delivery_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_attempt_number", columnNames = {"deliveryId", "attemptNumber"}),
        indexes = @Index(name = "idx_attempt_delivery", columnList = "deliveryId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String deliveryId;

    @Column(nullable = false)
    private Long webhookId;

    @Column(nullable = false)
    private int attemptNumber;

    @Column(nullable = false, length = 64)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeliveryStatus status;

    private Integer httpStatusCode;

    private Long responseTimeMs;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(length = 1000)
    private String responseBody;

    @Column(nullable = false)
    private Instant attemptedAt;

    private Instant nextRetryAt;
}
