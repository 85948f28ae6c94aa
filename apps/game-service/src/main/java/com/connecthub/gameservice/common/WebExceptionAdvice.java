package com.connecthub.gameservice.common;

import com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException;
import com.connecthub.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 对局意图被拒绝：NOT_FOUND → 404，BAD_REQUEST → 400，其余状态冲突 → 409。
     */
    @ExceptionHandler(SessionRejectedException.class)
    public ResponseEntity<ApiResponse<Object>> rejected(SessionRejectedException e) {
        return switch (e.getCode()) {
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
            case BAD_REQUEST -> ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
            default -> ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getCode() + ": " + e.getMessage()));
        };
    }

    /**
     * 参数不合法（IllegalArgumentException）→ 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 业务状态冲突（IllegalStateException）→ 409，如事件循环繁忙
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
