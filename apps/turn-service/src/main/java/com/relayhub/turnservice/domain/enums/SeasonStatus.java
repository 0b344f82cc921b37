package com.relayhub.turnservice.domain.enums;

/**
 * 赛季状态
 */
public enum SeasonStatus {
    SETUP,       // 配置中
    OPEN,        // 开放报名
    ACTIVE,      // 进行中
    COMPLETED,   // 全部对局结束
    TERMINATED;  // 被管理员终止

    /** 是否还允许加入 */
    public boolean acceptsPlayers() {
        return this == SETUP || this == OPEN;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == TERMINATED;
    }
}
