package com.relayhub.turnservice.domain.enums;

/**
 * 对局状态
 */
public enum GameStatus {
    PENDING_START,
    ACTIVE,
    COMPLETED,
    TERMINATED;

    public boolean isFinished() {
        return this == COMPLETED || this == TERMINATED;
    }
}
