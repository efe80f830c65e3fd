package com.seederr.tiering.exception;

import com.seederr.tiering.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 管理接口全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    /**
     * 调度线程忙
     */
    @ExceptionHandler(RebalanceBusyException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusy(RebalanceBusyException ex) {
        log.warn("Rebalance worker busy: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiResponse.serviceUnavailable(ex.getMessage()));
    }
    
    /**
     * 外部依赖不可用
     */
    @ExceptionHandler({SourceUnavailableException.class, StoreUnavailableException.class})
    public ResponseEntity<ApiResponse<Void>> handleDependencyDown(RuntimeException ex) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiResponse.serviceUnavailable(ex.getMessage()));
    }
    
    /**
     * 处理所有未捕获异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("internal error"));
    }
}
