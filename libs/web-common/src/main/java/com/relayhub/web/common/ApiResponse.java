package com.relayhub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * 约定：
 *  - code 与 HTTP 状态码保持一致，便于前端/机器人层统一处理；
 *  - reason 为机器可读的业务错误码（如 INVALID_STATE），成功时为 null；
 *  - message 为开发者可读的描述，不做本地化（本地化由展示层负责）。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误 / 提交内容不合法
     * 404: 资源不存在
     * 409: 状态冲突（前置状态不满足、并发竞争失败）
     * 422: 无可分配玩家等业务上无法继续的情况
     * 503: 调度持久化失败
     */
    int code,

    /**
     * 业务错误码（成功时为空）
     */
    String reason,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, null, "success", data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, null, message, data);
    }

    /**
     * 失败响应（带业务错误码）
     */
    public static <T> ApiResponse<T> error(int code, String reason, String message) {
        return new ApiResponse<>(code, reason, message, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, "BAD_REQUEST", message, null);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, "INTERNAL_ERROR", message, null);
    }

    /**
     * 是否成功
     */
    public boolean isSuccess() {
        return code == 200;
    }
}
