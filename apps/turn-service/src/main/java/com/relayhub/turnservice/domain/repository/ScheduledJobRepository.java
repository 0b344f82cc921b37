package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.model.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 超时任务 Repository
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    /**
     * 所有待触发任务（按到期时间升序），用于启动恢复
     */
    List<ScheduledJob> findAllByOrderByRunAtAsc();

    /**
     * 在给定时间点之前到期的任务，用于周期性补挂定时器
     */
    List<ScheduledJob> findByRunAtBeforeOrderByRunAtAsc(Instant deadline);

    /**
     * 消费任务：按 (id, fireToken) 条件删除。
     * @return 1 表示本次触发获得执行权；0 表示任务已被取消或被重新调度
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ScheduledJob j WHERE j.id = :id AND j.fireToken = :fireToken")
    int consume(@Param("id") String id, @Param("fireToken") String fireToken);

    /**
     * 取消任务
     * @return 删除行数
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ScheduledJob j WHERE j.id = :id")
    int deleteJob(@Param("id") String id);
}
