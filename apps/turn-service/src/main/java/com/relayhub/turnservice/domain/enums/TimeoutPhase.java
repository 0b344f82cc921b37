package com.relayhub.turnservice.domain.enums;

import java.util.Locale;

/**
 * 超时任务阶段：认领超时 / 提交超时 / 赛季报名期结束
 */
public enum TimeoutPhase {
    CLAIM,
    SUBMISSION,
    SEASON_OPEN;

    /**
     * 确定性的任务 ID：
     * 回合阶段为 turn-{phase}-timeout-{turnId}，报名期为 season-open-timeout-{seasonId}
     */
    public String jobId(Object targetId) {
        if (this == SEASON_OPEN) {
            return "season-open-timeout-" + targetId;
        }
        return "turn-" + name().toLowerCase(Locale.ROOT) + "-timeout-" + targetId;
    }
}
