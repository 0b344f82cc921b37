package com.relayhub.turnservice.config;

import com.relayhub.turnservice.domain.model.SeasonConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 新赛季的默认配置（relay.season.defaults.*），创建赛季时未指定的项取这里的值。
 */
@Component
@ConfigurationProperties(prefix = "relay.season.defaults")
public class SeasonDefaultsProperties {

    private int minPlayers = 6;

    private int maxPlayers = 20;

    /**
     * 回合类型序列，逗号分隔
     */
    private String turnPattern = "writing,drawing";

    /**
     * 认领窗口（分钟）
     */
    private int claimTimeoutMinutes = 1440;

    /**
     * 写作提交窗口（分钟）
     */
    private int writingTimeoutMinutes = 1440;

    /**
     * 绘画提交窗口（分钟）
     */
    private int drawingTimeoutMinutes = 4320;

    /**
     * 报名期（分钟），默认 7 天；0 表示不自动开赛
     */
    private int openDurationMinutes = 10080;

    public SeasonConfig toConfig() {
        return SeasonConfig.builder()
                .minPlayers(minPlayers)
                .maxPlayers(maxPlayers)
                .turnPattern(turnPattern)
                .claimTimeoutMinutes(claimTimeoutMinutes)
                .writingTimeoutMinutes(writingTimeoutMinutes)
                .drawingTimeoutMinutes(drawingTimeoutMinutes)
                .openDurationMinutes(openDurationMinutes)
                .build();
    }

    public int getMinPlayers() {
        return minPlayers;
    }

    public void setMinPlayers(int minPlayers) {
        this.minPlayers = minPlayers;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public void setMaxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
    }

    public String getTurnPattern() {
        return turnPattern;
    }

    public void setTurnPattern(String turnPattern) {
        this.turnPattern = turnPattern;
    }

    public int getClaimTimeoutMinutes() {
        return claimTimeoutMinutes;
    }

    public void setClaimTimeoutMinutes(int claimTimeoutMinutes) {
        this.claimTimeoutMinutes = claimTimeoutMinutes;
    }

    public int getWritingTimeoutMinutes() {
        return writingTimeoutMinutes;
    }

    public void setWritingTimeoutMinutes(int writingTimeoutMinutes) {
        this.writingTimeoutMinutes = writingTimeoutMinutes;
    }

    public int getDrawingTimeoutMinutes() {
        return drawingTimeoutMinutes;
    }

    public void setDrawingTimeoutMinutes(int drawingTimeoutMinutes) {
        this.drawingTimeoutMinutes = drawingTimeoutMinutes;
    }

    public int getOpenDurationMinutes() {
        return openDurationMinutes;
    }

    public void setOpenDurationMinutes(int openDurationMinutes) {
        this.openDurationMinutes = openDurationMinutes;
    }
}
