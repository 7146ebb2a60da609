package com.example.automation.controller;

import com.example.automation.dto.ScheduleRequest;
import com.example.automation.dto.ToggleRequest;
import com.example.automation.model.Schedule;
import com.example.automation.model.ScheduleExecution;
import com.example.automation.service.JobTriggerException;
import com.example.automation.service.ScheduleService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 调度管理接口，调用者身份取自 X-User-ID 请求头。
 */
@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    static final String USER_HEADER = "X-User-ID";

    private final ScheduleService scheduleService;

    @GetMapping
    public List<Schedule> list(@RequestHeader(USER_HEADER) String userId) {
        return scheduleService.list(userId);
    }

    @PostMapping
    public ResponseEntity<Schedule> create(@RequestHeader(USER_HEADER) String userId,
            @RequestBody ScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(userId, request));
    }

    @GetMapping("/project/{projectId}")
    public Schedule get(@RequestHeader(USER_HEADER) String userId, @PathVariable String projectId) {
        return scheduleService.get(userId, projectId);
    }

    @PutMapping("/project/{projectId}")
    public Schedule update(@RequestHeader(USER_HEADER) String userId, @PathVariable String projectId,
            @RequestBody ScheduleRequest request) {
        return scheduleService.update(userId, projectId, request);
    }

    @DeleteMapping("/project/{projectId}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String projectId) {
        scheduleService.delete(userId, projectId);
        return ResponseEntity.noContent().build();
    }

    /**
     * 启用/停用。不带 enabled 时取反当前状态。
     *
     * @param userId    调用者
     * @param projectId 项目 ID
     * @param request   可选的目标状态
     * @return 更新后的调度
     */
    @PostMapping("/project/{projectId}/toggle")
    public Schedule toggle(@RequestHeader(USER_HEADER) String userId, @PathVariable String projectId,
            @RequestBody(required = false) ToggleRequest request) {
        boolean enabled = request != null && request.getEnabled() != null
                ? request.getEnabled()
                : !scheduleService.get(userId, projectId).isEnabled();
        return scheduleService.setEnabled(userId, projectId, enabled);
    }

    @PostMapping("/project/{projectId}/run-now")
    public ScheduleExecution runNow(@RequestHeader(USER_HEADER) String userId, @PathVariable String projectId)
            throws JobTriggerException {
        return scheduleService.runNow(userId, projectId);
    }

    @GetMapping("/project/{projectId}/history")
    public Page<ScheduleExecution> history(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String projectId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize) {
        return scheduleService.history(userId, projectId, page, pageSize);
    }
}
