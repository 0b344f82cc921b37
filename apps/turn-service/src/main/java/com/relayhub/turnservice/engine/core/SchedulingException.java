package com.relayhub.turnservice.engine.core;

/**
 * 超时任务持久化失败
 */
public class SchedulingException extends EngineException {

    public SchedulingException(String message, Throwable cause) {
        super(ErrorCode.SCHEDULING, message, cause);
    }
}
