package com.relayhub.turnservice.engine.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 对局/赛季进度事件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameProgressEvent {

    private EventType eventType;

    private UUID seasonId;

    /**
     * 赛季级事件时为空
     */
    private UUID gameId;

    private Instant timestamp;

    public enum EventType {
        GAME_COMPLETED,
        SEASON_COMPLETED
    }

    public static GameProgressEvent gameCompleted(UUID seasonId, UUID gameId) {
        return new GameProgressEvent(EventType.GAME_COMPLETED, seasonId, gameId, Instant.now());
    }

    public static GameProgressEvent seasonCompleted(UUID seasonId) {
        return new GameProgressEvent(EventType.SEASON_COMPLETED, seasonId, null, Instant.now());
    }
}
