package com.relayhub.turnservice.engine.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 回合状态迁移事件。
 *
 * 每次迁移成功（事务提交前）通过 Spring ApplicationEventPublisher 发布，
 * 展示层（聊天机器人等）订阅后自行决定如何通知玩家。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TurnLifecycleEvent {

    private EventType eventType;

    private UUID turnId;

    private UUID gameId;

    /**
     * 迁移涉及的玩家（dismiss 时为被撤回邀请的玩家）
     */
    private UUID playerId;

    private Instant timestamp;

    /**
     * 事件类型枚举
     */
    public enum EventType {
        /** 发出邀请 */
        OFFERED,
        /** 玩家认领 */
        CLAIMED,
        /** 玩家提交 */
        COMPLETED,
        /** 邀请被撤回 */
        DISMISSED,
        /** 回合被跳过 */
        SKIPPED
    }

    public static TurnLifecycleEvent of(EventType eventType, UUID turnId, UUID gameId, UUID playerId) {
        return new TurnLifecycleEvent(eventType, turnId, gameId, playerId, Instant.now());
    }
}
