package com.seederr.tiering.exception;

/**
 * 调度线程忙，管理请求在等待时限内未拿到结果
 */
public class RebalanceBusyException extends RuntimeException {
    
    public RebalanceBusyException(String message) {
        super(message);
    }
    
    public RebalanceBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
