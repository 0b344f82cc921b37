package com.relayhub.turnservice.domain.model;

import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 持久化的超时任务
 * 对应数据库表：scheduled_job
 *
 * - 行存在即表示任务仍待触发；触发时先按 (id, fire_token) 删除再回调，保证至多一次；
 * - fire_token 每次（重新）调度都会刷新，旧定时器触发时因 token 不匹配而成为空操作。
 */
@Entity
@Table(name = "scheduled_job", indexes = @Index(name = "idx_job_run_at", columnList = "run_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    /**
     * 确定性 ID：turn-{phase}-timeout-{turnId}，报名期为 season-open-timeout-{seasonId}
     */
    @Id
    @Column(name = "id", length = 100, nullable = false, updatable = false)
    private String id;

    @Column(name = "phase", length = 20, nullable = false)
    @Enumerated(EnumType.STRING)
    private TimeoutPhase phase;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    /**
     * JSON 载荷（{@link TimeoutPayload}）
     */
    @Column(name = "payload", length = 500, nullable = false)
    private String payload;

    @Column(name = "fire_token", length = 36, nullable = false)
    private String fireToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
