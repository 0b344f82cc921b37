package com.relayhub.turnservice.clock;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 超时调度相关配置（relay.scheduler.*）。
 */
@Component
@ConfigurationProperties(prefix = "relay.scheduler")
public class SchedulerProperties {

    /**
     * 调度线程池核心线程数
     */
    private int corePoolSize = 2;

    /**
     * 装载窗口：到期时间超出该窗口的任务只保留持久化记录，不占用内存定时器
     */
    private Duration armHorizon = Duration.ofHours(6);

    /**
     * 补挂扫描间隔（毫秒）
     */
    private long sweepIntervalMs = 60_000L;

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public Duration getArmHorizon() {
        return armHorizon;
    }

    public void setArmHorizon(Duration armHorizon) {
        this.armHorizon = armHorizon;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }
}
