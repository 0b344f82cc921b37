package com.relayhub.turnservice.engine.lifecycle;

import com.relayhub.turnservice.domain.enums.ContentType;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.engine.core.EngineResult;

import java.util.UUID;

/**
 * 回合状态机。
 *
 * 每个迁移都是一次条件更新加上对应的超时任务增删，在同一事务内完成；
 * 前置状态不满足或并发竞争失败返回 INVALID_STATE，不抛异常。
 */
public interface TurnLifecycleManager {

    /**
     * AVAILABLE → OFFERED，并调度认领超时
     */
    EngineResult<Turn> offer(UUID turnId, UUID playerId);

    /**
     * OFFERED → PENDING，取消认领超时并调度提交超时
     */
    EngineResult<Turn> claim(UUID turnId, UUID playerId);

    /**
     * PENDING → COMPLETED，内容类型必须与回合类型匹配；成功后推进对局
     */
    EngineResult<Turn> submit(UUID turnId, UUID playerId, String content, ContentType contentType);

    /**
     * OFFERED → AVAILABLE，撤回邀请
     */
    EngineResult<Turn> dismiss(UUID turnId);

    /**
     * OFFERED/PENDING → SKIPPED；已结束的回合原样返回。成功后推进对局
     */
    EngineResult<Turn> skip(UUID turnId);
}
