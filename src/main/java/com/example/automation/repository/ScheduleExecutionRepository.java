package com.example.automation.repository;

import com.example.automation.model.ScheduleExecution;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * 调度执行历史仓储接口。
 */
@Repository
public interface ScheduleExecutionRepository extends JpaRepository<ScheduleExecution, Long> {

    Page<ScheduleExecution> findByProjectIdOrderByTriggeredAtDesc(String projectId, Pageable pageable);

    void deleteByProjectId(String projectId);
}
