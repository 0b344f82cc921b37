package com.relayhub.turnservice.clock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayhub.turnservice.clock.scheduler.TimeoutScheduler;
import com.relayhub.turnservice.clock.scheduler.TimeoutSchedulerImpl;
import com.relayhub.turnservice.domain.repository.ScheduledJobRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 超时调度 Bean 装配：把线程池、任务表与 JSON 序列化拼成通用调度引擎。
 * 这里不关心任何回合业务，超时后做什么由 TurnTimeoutCoordinator 注册。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public TimeoutScheduler timeoutScheduler(ScheduledJobRepository jobRepository,
                                             @Qualifier("turnTimeoutExecutor") ScheduledThreadPoolExecutor turnTimeoutExecutor,
                                             ObjectMapper objectMapper,
                                             SchedulerProperties properties) {
        return new TimeoutSchedulerImpl(jobRepository, turnTimeoutExecutor, objectMapper, properties);
    }
}
