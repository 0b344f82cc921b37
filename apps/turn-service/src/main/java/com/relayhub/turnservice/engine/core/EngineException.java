package com.relayhub.turnservice.engine.core;

import lombok.Getter;

/**
 * 引擎内部业务异常：携带错误码，在事务边界处转换为 {@link EngineResult} 或 HTTP 响应。
 */
@Getter
public class EngineException extends RuntimeException {

    private final ErrorCode code;

    public EngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static EngineException notFound(String message) {
        return new EngineException(ErrorCode.NOT_FOUND, message);
    }

    public static EngineException invalidState(String message) {
        return new EngineException(ErrorCode.INVALID_STATE, message);
    }

    public static EngineException validation(String message) {
        return new EngineException(ErrorCode.VALIDATION, message);
    }
}
