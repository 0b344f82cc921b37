package com.relayhub.turnservice.clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 超时定时线程池配置。
 *
 * 1. 核心线程数取自 relay.scheduler.core-pool-size；
 * 2. 线程命名为 relay-timeout-N，守护线程；
 * 3. 启用 setRemoveOnCancelPolicy(true)，取消的任务立即移出队列。
 *
 * 定时器只是"提醒"，任务的权威状态在 scheduled_job 表中，
 * 线程池关闭时被丢弃的任务会在下次启动 recover 时重新装载。
 */
@Configuration
public class ClockSchedulerConfig {

    @Bean(name = "turnTimeoutExecutor", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor turnTimeoutExecutor(SchedulerProperties properties) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "relay-timeout-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                properties.getCorePoolSize(), tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
