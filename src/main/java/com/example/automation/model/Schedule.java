package com.example.automation.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * 项目的定时调度定义，每个项目至多一条。
 */
@Entity
@Table(name = "schedules",
        uniqueConstraints = @UniqueConstraint(name = "uk_schedule_project", columnNames = "projectId"),
        indexes = @Index(name = "idx_schedule_due", columnList = "enabled,nextRun"))
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Frequency frequency = Frequency.DAILY;

    @Column(name = "time_of_day", length = 5)
    private String timeOfDay; // HH:mm，hourly 时为空

    @Column(name = "zone_id", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    private Integer dayOfWeek; // 0=周一 ... 6=周日

    private Integer dayOfMonth; // 1-28

    @Builder.Default
    private boolean enabled = true;

    private Instant nextRun;

    private Instant lastRun;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private RunStatus lastStatus;

    @Column(length = 64)
    private String lastJobId;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    private Instant lastClaimedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
