package com.example.automation.service;

import com.example.automation.dto.ScheduleRequest;
import com.example.automation.exception.ConflictException;
import com.example.automation.exception.InvalidRequestException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.model.Frequency;
import com.example.automation.model.RunStatus;
import com.example.automation.model.Schedule;
import com.example.automation.model.ScheduleExecution;
import com.example.automation.model.TriggerSource;
import com.example.automation.repository.ScheduleExecutionRepository;
import com.example.automation.repository.ScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 调度管理：增删改查、启停与手动运行。
 * <p>
 * 每次修改定义都会重新计算 nextRun；停用时 nextRun 置空。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    public static final int MAX_PAGE_SIZE = 100;

    private final ScheduleRepository scheduleRepository;
    private final ScheduleExecutionRepository executionRepository;
    private final ScheduleValidator validator;
    private final NextRunCalculator calculator;
    private final JobTrigger jobTrigger;
    private final Clock clock;

    /**
     * 为项目创建调度，每个项目至多一个。
     *
     * @param userId  调用者
     * @param request 调度定义
     * @return 保存后的调度
     */
    @Transactional
    public Schedule create(String userId, ScheduleRequest request) {
        String projectId = request.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidRequestException("projectId is required");
        }
        if (scheduleRepository.existsByProjectId(projectId)) {
            throw new ConflictException("Schedule already exists for project " + projectId);
        }

        Schedule schedule = Schedule.builder()
                .projectId(projectId)
                .userId(userId)
                .frequency(request.getFrequency())
                .timeOfDay(request.getTime())
                .timezone(request.getTimezone() != null ? request.getTimezone() : "UTC")
                .dayOfWeek(request.getDayOfWeek())
                .dayOfMonth(request.getDayOfMonth())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
        validator.validate(schedule);
        refreshNextRun(schedule);

        try {
            schedule = scheduleRepository.saveAndFlush(schedule);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Schedule already exists for project " + projectId);
        }
        log.info("Created {} schedule for project {}, next run {}",
                schedule.getFrequency(), projectId, schedule.getNextRun());
        return schedule;
    }

    public Schedule get(String userId, String projectId) {
        return scheduleRepository.findByProjectIdAndUserId(projectId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule not found for project " + projectId));
    }

    public List<Schedule> list(String userId) {
        return scheduleRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * 修改调度定义。频率变化时，不适用于新频率的日期字段会被清除。
     */
    @Transactional
    public Schedule update(String userId, String projectId, ScheduleRequest request) {
        Schedule schedule = get(userId, projectId);

        if (request.getFrequency() != null && request.getFrequency() != schedule.getFrequency()) {
            Frequency frequency = request.getFrequency();
            schedule.setFrequency(frequency);
            if (frequency != Frequency.WEEKLY) {
                schedule.setDayOfWeek(null);
            }
            if (frequency != Frequency.MONTHLY) {
                schedule.setDayOfMonth(null);
            }
            if (frequency == Frequency.HOURLY) {
                schedule.setTimeOfDay(null);
            }
        }
        if (request.getTime() != null) {
            schedule.setTimeOfDay(request.getTime());
        }
        if (request.getTimezone() != null) {
            schedule.setTimezone(request.getTimezone());
        }
        if (request.getDayOfWeek() != null) {
            schedule.setDayOfWeek(request.getDayOfWeek());
        }
        if (request.getDayOfMonth() != null) {
            schedule.setDayOfMonth(request.getDayOfMonth());
        }
        if (request.getEnabled() != null) {
            schedule.setEnabled(request.getEnabled());
        }

        validator.validate(schedule);
        refreshNextRun(schedule);
        log.info("Updated schedule for project {}, next run {}", projectId, schedule.getNextRun());
        return scheduleRepository.save(schedule);
    }

    /**
     * 设置启用状态。
     *
     * @param enabled 目标状态（由接口层给出明确值）
     */
    @Transactional
    public Schedule setEnabled(String userId, String projectId, boolean enabled) {
        Schedule schedule = get(userId, projectId);
        schedule.setEnabled(enabled);
        refreshNextRun(schedule);
        log.info("Schedule for project {} {}", projectId, enabled ? "enabled" : "disabled");
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public void delete(String userId, String projectId) {
        Schedule schedule = get(userId, projectId);
        executionRepository.deleteByProjectId(projectId);
        scheduleRepository.delete(schedule);
        log.info("Deleted schedule for project {}", projectId);
    }

    /**
     * 立即运行一次：直接调用任务触发，不读取也不修改 nextRun 等调度字段，仅写入执行历史。
     *
     * @return 执行记录
     * @throws JobTriggerException 触发失败（失败的执行同样会被记录）
     */
    public ScheduleExecution runNow(String userId, String projectId) throws JobTriggerException {
        Schedule schedule = get(userId, projectId);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        ScheduleExecution execution = ScheduleExecution.builder()
                .scheduleId(schedule.getId())
                .projectId(projectId)
                .trigger(TriggerSource.MANUAL)
                .triggeredAt(now)
                .build();
        try {
            execution.setJobId(jobTrigger.triggerJob(projectId, TriggerSource.MANUAL));
            execution.setStatus(RunStatus.COMPLETED);
        } catch (JobTriggerException e) {
            execution.setStatus(RunStatus.FAILED);
            execution.setError(e.getMessage());
            executionRepository.save(execution);
            log.warn("Manual run for project {} failed: {}", projectId, e.getMessage());
            throw e;
        }

        log.info("Manual run for project {} started job {}", projectId, execution.getJobId());
        return executionRepository.save(execution);
    }

    /**
     * 分页查询执行历史，最新的在前。
     */
    public Page<ScheduleExecution> history(String userId, String projectId, int page, int pageSize) {
        get(userId, projectId);
        if (page < 1 || pageSize < 1) {
            throw new InvalidRequestException("page and pageSize must be positive");
        }
        return executionRepository.findByProjectIdOrderByTriggeredAtDesc(projectId,
                PageRequest.of(page - 1, Math.min(pageSize, MAX_PAGE_SIZE)));
    }

    private void refreshNextRun(Schedule schedule) {
        if (schedule.isEnabled()) {
            schedule.setNextRun(calculator.computeNextRun(schedule, clock.instant()));
        } else {
            schedule.setNextRun(null);
        }
    }
}
