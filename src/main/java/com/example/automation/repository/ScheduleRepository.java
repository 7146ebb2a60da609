package com.example.automation.repository;

import com.example.automation.model.RunStatus;
import com.example.automation.model.Schedule;
import org.springframework.data.domain.Pageable;
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
 * 调度仓储接口。
 * <p>
 * 所有由调度循环发起的写操作都是带条件的单行 UPDATE，依靠受影响行数判断是否抢占成功。
 */
@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

        /**
         * 根据项目查询调度。
         *
         * @param projectId 项目 ID
         * @param userId    用户 ID
         * @return 调度
         */
        Optional<Schedule> findByProjectIdAndUserId(String projectId, String userId);

        boolean existsByProjectId(String projectId);

        List<Schedule> findByUserIdOrderByCreatedAtDesc(String userId);

        long countByEnabledTrue();

        /**
         * 查询已到期的启用调度。
         *
         * @param now      当前时间
         * @param pageable 批量上限
         * @return 到期调度
         */
        @Query("SELECT s FROM Schedule s WHERE s.enabled = true AND s.nextRun <= :now ORDER BY s.nextRun ASC")
        List<Schedule> findDue(@Param("now") Instant now, Pageable pageable);

        /**
         * 抢占到期调度：仅当 nextRun 仍等于读取到的值时才更新。
         *
         * @param id              调度 ID
         * @param expectedNextRun 读取时的 nextRun
         * @param provisional     抢占后暂存的下一次运行时间
         * @param claimedAt       抢占时间
         * @return 1 表示抢占成功，0 表示已被其他实例抢占或已被修改
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Schedule s SET s.nextRun = :provisional, s.lastClaimedAt = :claimedAt "
                        + "WHERE s.id = :id AND s.enabled = true AND s.nextRun = :expectedNextRun")
        int claim(@Param("id") Long id,
                        @Param("expectedNextRun") Instant expectedNextRun,
                        @Param("provisional") Instant provisional,
                        @Param("claimedAt") Instant claimedAt);

        /**
         * 记录本次触发结果。
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Schedule s SET s.lastRun = :lastRun, s.lastStatus = :status, s.lastJobId = :jobId, "
                        + "s.lastError = :error, s.updatedAt = :lastRun WHERE s.id = :id")
        int recordOutcome(@Param("id") Long id,
                        @Param("lastRun") Instant lastRun,
                        @Param("status") RunStatus status,
                        @Param("jobId") String jobId,
                        @Param("error") String error);

        /**
         * 推进 nextRun。期间若用户修改或停用了调度，则以用户的写入为准。
         *
         * @return 受影响行数
         */
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Transactional
        @Query("UPDATE Schedule s SET s.nextRun = :nextRun "
                        + "WHERE s.id = :id AND s.enabled = true AND s.nextRun = :expectedNextRun")
        int advanceNextRun(@Param("id") Long id,
                        @Param("expectedNextRun") Instant expectedNextRun,
                        @Param("nextRun") Instant nextRun);
}
