package com.relayhub.turnservice.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * 回合状态机：
 * AVAILABLE → OFFERED → PENDING → COMPLETED
 *      ↑          │          │
 *      └─ dismiss ┘          └─→ SKIPPED（OFFERED 也可直接 skip）
 */
public enum TurnStatus {
    AVAILABLE,  // 待分配
    OFFERED,    // 已发出邀请，等待认领
    PENDING,    // 已认领，等待提交
    COMPLETED,  // 已提交
    SKIPPED;    // 超时或被跳过

    /** 计入“已被分配过”的状态（用于选人统计与同局唯一性） */
    public static final Set<TurnStatus> ASSIGNED = EnumSet.of(OFFERED, PENDING, COMPLETED, SKIPPED);

    /** 终态 */
    public static final Set<TurnStatus> FINISHED = EnumSet.of(COMPLETED, SKIPPED);

    public boolean isFinished() {
        return FINISHED.contains(this);
    }
}
