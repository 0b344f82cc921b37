package com.relayhub.turnservice.engine.core;

import org.springframework.http.HttpStatus;

/**
 * 引擎错误码及其对应的 HTTP 状态
 */
public enum ErrorCode {
    /** 回合/对局/赛季/玩家不存在 */
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** 前置状态不满足，或并发竞争失败 */
    INVALID_STATE(HttpStatus.CONFLICT),
    /** 提交内容不合法 */
    VALIDATION(HttpStatus.BAD_REQUEST),
    /** 没有可分配的玩家 */
    NO_ELIGIBLE_PLAYERS(HttpStatus.UNPROCESSABLE_ENTITY),
    /** 超时任务持久化失败 */
    SCHEDULING(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
