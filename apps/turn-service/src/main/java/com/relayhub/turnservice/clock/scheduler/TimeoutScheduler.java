package com.relayhub.turnservice.clock.scheduler;

import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.model.ScheduledJob;
import com.relayhub.turnservice.domain.model.TimeoutPayload;

import java.time.Instant;

/**
 * TimeoutScheduler
 * ---------------------------------------
 * 持久化的"一次性超时"调度器，独立于回合业务。
 *
 *  - 任务先写入 scheduled_job 表，再装载进程内定时器（有事务时在提交后装载）；
 *  - 触发时先按 (id, fireToken) 条件删除，删除成功才回调，因此同一任务至多执行一次；
 *  - 进程重启后由 {@link #recover()} 从表中重新装载，已过期的立即触发。
 */
public interface TimeoutScheduler {

    /**
     * 到期回调。按阶段注册，由上层协调器实现权威业务处理。
     */
    @FunctionalInterface
    interface TimeoutHandler {
        /**
         * @param jobId   任务ID
         * @param payload 调度时写入的载荷
         */
        void onTimeout(String jobId, TimeoutPayload payload);
    }

    /**
     * 注册某个阶段的到期回调（重复注册以最后一次为准）
     */
    void registerHandler(TimeoutPhase phase, TimeoutHandler handler);

    /**
     * 调度（或重新调度）任务。同一 jobId 再次调度会替换之前的定时器。
     *
     * @throws com.relayhub.turnservice.engine.core.SchedulingException 持久化失败
     */
    void schedule(String jobId, Instant runAt, TimeoutPayload payload, TimeoutPhase phase);

    /**
     * 取消任务
     * @return 是否存在待触发的任务记录
     */
    boolean cancel(String jobId);

    /**
     * 到期处理：消费任务记录并回调。记录已被取消或被重新调度时为空操作；回调异常只记录日志。
     */
    void onFire(ScheduledJob job);

    /**
     * 启动恢复：装载所有持久化任务
     * @return 读取到的任务数
     */
    int recover();

    /**
     * 补挂扫描：为进入装载窗口、但没有存活定时器的任务装载定时器
     * @return 本次新装载的数量
     */
    int reconcile();
}
