package com.relayhub.turnservice.domain.model;

import java.util.UUID;

/**
 * 超时任务载荷：到期时据此校验回合是否仍属于该玩家
 *
 * @param turnId   回合ID（赛季级任务为空）
 * @param playerId 调度时回合所属玩家（赛季级任务为空）
 * @param seasonId 赛季ID（仅赛季级任务）
 */
public record TimeoutPayload(UUID turnId, UUID playerId, UUID seasonId) {

    public TimeoutPayload(UUID turnId, UUID playerId) {
        this(turnId, playerId, null);
    }

    public static TimeoutPayload forSeason(UUID seasonId) {
        return new TimeoutPayload(null, null, seasonId);
    }
}
