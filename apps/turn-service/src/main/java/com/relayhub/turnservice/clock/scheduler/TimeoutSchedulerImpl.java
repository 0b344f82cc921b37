package com.relayhub.turnservice.clock.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayhub.turnservice.clock.SchedulerProperties;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.model.ScheduledJob;
import com.relayhub.turnservice.domain.model.TimeoutPayload;
import com.relayhub.turnservice.domain.repository.ScheduledJobRepository;
import com.relayhub.turnservice.engine.core.SchedulingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TimeoutSchedulerImpl
 * ---------------------------------------
 * 基于数据库任务表 + ScheduledExecutorService 的默认实现。
 *
 * 职责：
 *  - 任务持久化（upsert），每次调度生成新的 fireToken；
 *  - 维护 jobId → 定时器句柄；只装载 arm-horizon 以内到期的任务，其余由 reconcile 周期补挂；
 *  - 触发时条件消费任务记录，再回调对应阶段的处理器。
 *
 * 不做的事：
 *  - 不判断回合状态，回调内的校验由上层负责。
 */
@Slf4j
public class TimeoutSchedulerImpl implements TimeoutScheduler {

    private final ScheduledJobRepository jobRepository;
    private final ScheduledExecutorService executor;
    private final ObjectMapper objectMapper;
    private final SchedulerProperties properties;

    // 阶段 -> 到期回调
    private final Map<TimeoutPhase, TimeoutHandler> handlers = new EnumMap<>(TimeoutPhase.class);

    // jobId -> 已装载的定时器
    private final ConcurrentMap<String, ArmedTimer> armed = new ConcurrentHashMap<>();

    public TimeoutSchedulerImpl(ScheduledJobRepository jobRepository,
                                ScheduledExecutorService executor,
                                ObjectMapper objectMapper,
                                SchedulerProperties properties) {
        this.jobRepository = jobRepository;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public synchronized void registerHandler(TimeoutPhase phase, TimeoutHandler handler) {
        handlers.put(phase, handler);
    }

    @Override
    public void schedule(String jobId, Instant runAt, TimeoutPayload payload, TimeoutPhase phase) {
        ScheduledJob job = ScheduledJob.builder()
                .id(jobId)
                .phase(phase)
                .runAt(runAt)
                .payload(writePayload(payload))
                .fireToken(UUID.randomUUID().toString())
                .createdAt(Instant.now())
                .build();
        try {
            // 指定主键的实体 save 走 merge：存在则覆盖，不存在则插入
            jobRepository.saveAndFlush(job);
        } catch (DataAccessException e) {
            throw new SchedulingException("超时任务持久化失败: " + jobId, e);
        }
        log.debug("超时任务已持久化: jobId={}, runAt={}", jobId, runAt);
        afterCommit(() -> arm(job));
    }

    @Override
    public boolean cancel(String jobId) {
        int deleted;
        try {
            deleted = jobRepository.deleteJob(jobId);
        } catch (DataAccessException e) {
            throw new SchedulingException("超时任务取消失败: " + jobId, e);
        }
        // 立即撤掉定时器；事务若回滚，记录仍在，由 reconcile 重新装载
        disarm(jobId);
        if (deleted > 0) {
            log.debug("超时任务已取消: jobId={}", jobId);
        }
        return deleted > 0;
    }

    @Override
    public void onFire(ScheduledJob job) {
        String jobId = job.getId();
        // 只移除自己这一代的定时器句柄
        armed.computeIfPresent(jobId, (k, t) -> t.fireToken().equals(job.getFireToken()) ? null : t);

        TimeoutHandler handler;
        synchronized (this) {
            handler = handlers.get(job.getPhase());
        }
        if (handler == null) {
            // 不消费：留给下一次 reconcile
            log.warn("超时任务无处理器，暂不消费: jobId={}, phase={}", jobId, job.getPhase());
            return;
        }

        int consumed;
        try {
            consumed = jobRepository.consume(jobId, job.getFireToken());
        } catch (DataAccessException e) {
            log.error("超时任务消费失败，等待下次补挂: jobId={}", jobId, e);
            return;
        }
        if (consumed == 0) {
            // 已被取消或被重新调度
            log.debug("超时任务已失效，忽略: jobId={}", jobId);
            return;
        }

        log.info("超时任务触发: jobId={}, phase={}, runAt={}", jobId, job.getPhase(), job.getRunAt());
        try {
            handler.onTimeout(jobId, readPayload(job));
        } catch (Exception e) {
            log.error("超时回调执行失败: jobId={}", jobId, e);
        }
    }

    @Override
    public int recover() {
        List<ScheduledJob> jobs = jobRepository.findAllByOrderByRunAtAsc();
        Instant now = Instant.now();
        int armedCount = 0;
        int overdue = 0;
        int deferred = 0;
        for (ScheduledJob job : jobs) {
            if (!job.getRunAt().isAfter(now)) {
                overdue++;
            }
            if (arm(job)) {
                armedCount++;
            } else {
                deferred++;
            }
        }
        log.info("TimeoutScheduler recover done: total={}, armed={}, overdue={}, deferred={}",
                jobs.size(), armedCount, overdue, deferred);
        return jobs.size();
    }

    @Override
    @Scheduled(fixedDelayString = "${relay.scheduler.sweep-interval-ms:60000}",
            initialDelayString = "${relay.scheduler.sweep-interval-ms:60000}")
    public int reconcile() {
        List<ScheduledJob> due;
        try {
            due = jobRepository.findByRunAtBeforeOrderByRunAtAsc(Instant.now().plus(properties.getArmHorizon()));
        } catch (DataAccessException e) {
            log.warn("补挂扫描读取任务失败: {}", e.getMessage());
            return 0;
        }
        int rearmed = 0;
        for (ScheduledJob job : due) {
            if (isLive(job)) {
                continue;
            }
            // 快照可能已过时：重排或取消会在扫描期间改写记录，按最新一行决定是否重挂
            Optional<ScheduledJob> fresh;
            try {
                fresh = jobRepository.findById(job.getId());
            } catch (DataAccessException e) {
                log.warn("补挂扫描重读任务失败: jobId={}, {}", job.getId(), e.getMessage());
                continue;
            }
            if (fresh.isEmpty() || isLive(fresh.get())) {
                continue;
            }
            if (arm(fresh.get())) {
                rearmed++;
            }
        }
        if (rearmed > 0) {
            log.info("TimeoutScheduler reconcile: rearmed={}", rearmed);
        }
        return rearmed;
    }

    /**
     * 当前持有定时器的任务数
     */
    public int armedCount() {
        return armed.size();
    }

    /**
     * 装载定时器；超出装载窗口时只撤掉旧定时器
     * @return 是否已装载
     */
    private boolean arm(ScheduledJob job) {
        long delayMs = Math.max(0L, Duration.between(Instant.now(), job.getRunAt()).toMillis());
        if (delayMs > properties.getArmHorizon().toMillis()) {
            disarm(job.getId());
            return false;
        }
        ScheduledFuture<?> future = executor.schedule(() -> onFire(job), delayMs, TimeUnit.MILLISECONDS);
        ArmedTimer previous = armed.put(job.getId(), new ArmedTimer(job.getFireToken(), future));
        if (previous != null && previous.future() != future) {
            previous.future().cancel(false);
        }
        return true;
    }

    private boolean isLive(ScheduledJob job) {
        ArmedTimer current = armed.get(job.getId());
        return current != null && current.fireToken().equals(job.getFireToken()) && !current.future().isDone();
    }

    private void disarm(String jobId) {
        ArmedTimer t = armed.remove(jobId);
        if (t != null) {
            t.future().cancel(false);
        }
    }

    /**
     * 有活动事务时在提交后执行，否则立即执行
     */
    private void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    private String writePayload(TimeoutPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SchedulingException("超时任务载荷序列化失败", e);
        }
    }

    private TimeoutPayload readPayload(ScheduledJob job) throws JsonProcessingException {
        return objectMapper.readValue(job.getPayload(), TimeoutPayload.class);
    }

    /**
     * 已装载的定时器：fireToken 标识它属于哪一次调度
     */
    private record ArmedTimer(String fireToken, ScheduledFuture<?> future) {
    }
}
