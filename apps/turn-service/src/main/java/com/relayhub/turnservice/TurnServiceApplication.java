package com.relayhub.turnservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * turn-service 启动入口。
 * 通过 @EnableScheduling 启用超时任务的周期补挂扫描。
 */
@SpringBootApplication
@EnableScheduling
public class TurnServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TurnServiceApplication.class, args);
    }
}
