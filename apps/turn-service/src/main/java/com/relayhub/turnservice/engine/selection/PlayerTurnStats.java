package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnType;

import java.util.UUID;

/**
 * 单个赛季成员的回合统计（选人规则的输入）
 *
 * @param playerId        玩家ID
 * @param writingCount    赛季内已被分配的写作回合数（OFFERED/PENDING/COMPLETED/SKIPPED）
 * @param drawingCount    赛季内已被分配的绘画回合数
 * @param pendingTurns    赛季内处于 PENDING 的回合数
 * @param hasPlayedInGame 本局是否已被分配过回合
 */
public record PlayerTurnStats(UUID playerId,
                              int writingCount,
                              int drawingCount,
                              int pendingTurns,
                              boolean hasPlayedInGame) {

    public int count(TurnType type) {
        return type == TurnType.WRITING ? writingCount : drawingCount;
    }
}
