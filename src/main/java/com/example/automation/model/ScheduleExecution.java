package com.example.automation.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 调度执行历史（定时触发与手动 run-now 均记录）。
 */
@Entity
@Table(name = "schedule_executions",
        indexes = @Index(name = "idx_execution_project", columnList = "projectId,triggeredAt"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long scheduleId;

    @Column(nullable = false, length = 64)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 16)
    private TriggerSource trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    @Column(length = 64)
    private String jobId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String error;

    @Column(nullable = false)
    private Instant triggeredAt;
}
