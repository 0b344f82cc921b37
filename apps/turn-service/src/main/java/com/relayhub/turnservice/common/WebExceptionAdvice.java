package com.relayhub.turnservice.common;

import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 引擎业务异常：按错误码映射 HTTP 状态
     * NOT_FOUND→404，INVALID_STATE→409，VALIDATION→400，NO_ELIGIBLE_PLAYERS→422，SCHEDULING→503
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiResponse<Object>> engine(EngineException e) {
        HttpStatus status = e.getCode().httpStatus();
        if (status.is5xxServerError()) {
            log.error("请求处理失败: code={}, message={}", e.getCode(), e.getMessage(), e);
        }
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), e.getCode().name(), e.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid），取第一个字段错误
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "请求参数不合法";
        return ResponseEntity.badRequest().body(ApiResponse.badRequest(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ApiResponse.badRequest("请求体格式错误"));
    }

    /**
     * 参数不合法（IllegalArgumentException）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ApiResponse.badRequest(e.getMessage()));
    }
}
