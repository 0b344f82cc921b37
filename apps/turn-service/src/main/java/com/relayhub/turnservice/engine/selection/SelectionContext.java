package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnType;

import java.util.UUID;

/**
 * 一次选人的上下文
 *
 * @param gameId             对局ID
 * @param turnType           待分配回合的类型
 * @param totalSeasonPlayers 赛季成员总数
 * @param previousPlayerId   本局上一个已结束回合的玩家（没有则为 null）
 */
public record SelectionContext(UUID gameId,
                               TurnType turnType,
                               int totalSeasonPlayers,
                               UUID previousPlayerId) {
}
