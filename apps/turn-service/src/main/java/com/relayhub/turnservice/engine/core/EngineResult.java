package com.relayhub.turnservice.engine.core;

import java.util.function.Function;

/**
 * 引擎操作结果：成功时带值，失败时带错误码与描述。
 * 生命周期与选人操作不抛业务异常，统一返回此类型。
 *
 * @param <T> 结果值类型
 */
public record EngineResult<T>(T value, ErrorCode error, String message) {

    public static <T> EngineResult<T> ok(T value) {
        return new EngineResult<>(value, null, null);
    }

    public static <T> EngineResult<T> fail(ErrorCode error, String message) {
        return new EngineResult<>(null, error, message);
    }

    public static <T> EngineResult<T> fail(EngineException e) {
        return fail(e.getCode(), e.getMessage());
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * 成功时转换结果值，失败时原样透传错误
     */
    public <R> EngineResult<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : fail(error, message);
    }

    /**
     * 取值；失败时抛出 {@link EngineException}（供 Controller 层交给全局异常处理）
     */
    public T orThrow() {
        if (!isOk()) {
            throw new EngineException(error, message);
        }
        return value;
    }
}
