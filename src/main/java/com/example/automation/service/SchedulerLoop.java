package com.example.automation.service;

import com.example.automation.event.JobEvent;
import com.example.automation.event.JobEventPublisher;
import com.example.automation.model.EventType;
import com.example.automation.model.RunStatus;
import com.example.automation.model.Schedule;
import com.example.automation.model.ScheduleExecution;
import com.example.automation.model.TriggerSource;
import com.example.automation.repository.ScheduleExecutionRepository;
import com.example.automation.repository.ScheduleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调度循环：按固定间隔扫描到期调度，抢占后触发任务并推进 nextRun。
 * <p>
 * 抢占是单条带条件的 UPDATE，多个实例或重叠的 tick 同时运行时，同一个到期调度只会被触发一次。
 */
@Component
@Slf4j
public class SchedulerLoop {

    private final ScheduleRepository scheduleRepository;
    private final ScheduleExecutionRepository executionRepository;
    private final NextRunCalculator calculator;
    private final JobTrigger jobTrigger;
    private final JobEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int batchSize;

    public SchedulerLoop(ScheduleRepository scheduleRepository,
            ScheduleExecutionRepository executionRepository,
            NextRunCalculator calculator,
            JobTrigger jobTrigger,
            JobEventPublisher eventPublisher,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${app.scheduler.batch-size:100}") int batchSize) {
        this.scheduleRepository = scheduleRepository;
        this.executionRepository = executionRepository;
        this.calculator = calculator;
        this.jobTrigger = jobTrigger;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.tick-interval-ms:60000}",
            initialDelayString = "${app.scheduler.initial-delay-ms:10000}")
    public void tick() {
        try {
            int triggered = runOnce();
            if (triggered > 0) {
                log.info("Scheduler tick triggered {} schedule(s)", triggered);
            }
        } catch (Exception e) {
            // 存储不可用等基础设施故障，下个 tick 重试
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 执行一轮扫描。
     *
     * @return 本轮抢占并触发的调度数
     */
    public int runOnce() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<Schedule> due = scheduleRepository.findDue(now, PageRequest.of(0, batchSize));
        int triggered = 0;
        for (Schedule schedule : due) {
            try {
                if (process(schedule, now)) {
                    triggered++;
                }
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to process schedule {} (project {}): {}",
                        schedule.getId(), schedule.getProjectId(), e.getMessage(), e);
            }
        }
        return triggered;
    }

    /**
     * 处理单个到期调度。
     *
     * @return false 表示抢占失败（已被其他实例处理或已被用户修改）
     */
    boolean process(Schedule schedule, Instant now) {
        Instant provisional = calculator.computeNextRun(schedule, now);
        if (scheduleRepository.claim(schedule.getId(), schedule.getNextRun(), provisional, now) != 1) {
            log.debug("Schedule {} already claimed, skipping", schedule.getId());
            return false;
        }
        log.info("Claimed schedule {} for project {} (due {})",
                schedule.getId(), schedule.getProjectId(), schedule.getNextRun());

        String jobId = null;
        String error = null;
        try {
            jobId = jobTrigger.triggerJob(schedule.getProjectId(), TriggerSource.SCHEDULED);
        } catch (JobTriggerException e) {
            error = e.getMessage();
        } catch (RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
        }
        RunStatus status = error == null ? RunStatus.COMPLETED : RunStatus.FAILED;

        scheduleRepository.recordOutcome(schedule.getId(), now, status, jobId, error);
        executionRepository.save(ScheduleExecution.builder()
                .scheduleId(schedule.getId())
                .projectId(schedule.getProjectId())
                .trigger(TriggerSource.SCHEDULED)
                .status(status)
                .jobId(jobId)
                .error(error)
                .triggeredAt(now)
                .build());

        // 以当前定义重新计算；用户在触发期间的修改优先
        scheduleRepository.findById(schedule.getId())
                .filter(Schedule::isEnabled)
                .ifPresent(current -> scheduleRepository.advanceNextRun(
                        current.getId(), provisional, calculator.computeNextRun(current, now)));

        if (status == RunStatus.COMPLETED) {
            log.info("Schedule {} triggered job {} for project {}", schedule.getId(), jobId, schedule.getProjectId());
        } else {
            log.warn("Schedule {} failed to trigger job for project {}: {}",
                    schedule.getId(), schedule.getProjectId(), error);
        }

        meterRegistry.counter("automation.schedule.runs", "status", status.name().toLowerCase()).increment();
        publish(schedule, status, jobId, error, now);
        return true;
    }

    private void publish(Schedule schedule, RunStatus status, String jobId, String error, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("frequency", schedule.getFrequency().name().toLowerCase());
        if (error != null) {
            data.put("error", error);
        }
        try {
            eventPublisher.publish(JobEvent.builder()
                    .eventType(status == RunStatus.COMPLETED ? EventType.SCHEDULE_TRIGGERED : EventType.SCHEDULE_FAILED)
                    .userId(schedule.getUserId())
                    .projectId(schedule.getProjectId())
                    .jobId(jobId)
                    .data(data)
                    .occurredAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to publish schedule event for project {}: {}", schedule.getProjectId(), e.getMessage());
        }
    }
}
