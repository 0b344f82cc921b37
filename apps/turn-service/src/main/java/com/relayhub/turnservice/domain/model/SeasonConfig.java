package com.relayhub.turnservice.domain.model;

import com.relayhub.turnservice.domain.enums.TurnType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * 赛季配置（内嵌在 season 表中）
 * - turnPattern：逗号分隔的回合类型序列，如 "writing,drawing"
 * - 各超时时长单位均为分钟，在调度时读取，不在触发时重新计算
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonConfig {

    @Column(name = "min_players", nullable = false)
    private int minPlayers;

    @Column(name = "max_players", nullable = false)
    private int maxPlayers;

    @Column(name = "turn_pattern", length = 200, nullable = false)
    private String turnPattern;

    @Column(name = "claim_timeout_minutes", nullable = false)
    private int claimTimeoutMinutes;

    @Column(name = "writing_timeout_minutes", nullable = false)
    private int writingTimeoutMinutes;

    @Column(name = "drawing_timeout_minutes", nullable = false)
    private int drawingTimeoutMinutes;

    /**
     * 报名期（分钟）：到期后人数足够则自动开赛，否则终止。为空或 0 表示只能手动开赛
     */
    @Column(name = "open_duration_minutes")
    private Integer openDurationMinutes;

    /**
     * 解析回合类型序列
     */
    public List<TurnType> patternTypes() {
        return Arrays.stream(turnPattern.split(","))
                .filter(s -> !s.isBlank())
                .map(TurnType::parse)
                .toList();
    }

    /**
     * 第 n 个回合（从 1 开始）的类型：按 pattern 循环
     */
    public TurnType typeForTurn(int turnNumber) {
        List<TurnType> pattern = patternTypes();
        if (pattern.isEmpty()) {
            throw new IllegalStateException("turnPattern 为空: " + turnPattern);
        }
        return pattern.get((turnNumber - 1) % pattern.size());
    }

    public boolean hasOpenDuration() {
        return openDurationMinutes != null && openDurationMinutes > 0;
    }

    /**
     * 提交窗口时长（分钟），按回合类型区分
     */
    public int submissionTimeoutMinutes(TurnType type) {
        return type == TurnType.WRITING ? writingTimeoutMinutes : drawingTimeoutMinutes;
    }
}
